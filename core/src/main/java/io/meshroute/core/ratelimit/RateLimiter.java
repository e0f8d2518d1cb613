package io.meshroute.core.ratelimit;

import reactor.core.publisher.Mono;

/**
 * Admission control keyed by subject.
 * <p>
 * Implementations: {@link LocalTokenBucketRateLimiter} (in-process) and the
 * Redis sliding window limiter (shared across router processes).
 * </p>
 */
public interface RateLimiter {

    /**
     * Counts one request for {@code subjectKey} against {@code rule}.
     *
     * @param subjectKey Key built by {@link SubjectKeys}
     * @param rule       Rule to enforce
     * @return decision with rate limit headers; never errors
     */
    Mono<RateLimitDecision> check(String subjectKey, RateLimitRule rule);
}
