package io.meshroute.router.redis;

import io.meshroute.core.ratelimit.RateLimitDecision;
import io.meshroute.core.ratelimit.RateLimitFailurePolicy;
import io.meshroute.core.ratelimit.RateLimitRule;
import io.meshroute.core.ratelimit.RateLimiter;
import io.meshroute.core.redis.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.UUID;

/**
 * Sliding-window rate limiter shared by every router process through Redis.
 * <p>
 * A request is allowed iff fewer than {@code requestsAllowed} requests were counted
 * in the trailing window before it. Rejected requests are counted too, so a caller
 * hammering a closed window keeps it closed.
 * </p>
 * <p>
 * When Redis is unreachable the {@link RateLimitFailurePolicy} decides: FAIL_OPEN
 * allows the request with unchecked headers, FAIL_CLOSED rejects it.
 * </p>
 */
public class RedisSlidingWindowRateLimiter implements RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RedisSlidingWindowRateLimiter.class);

    private final IRedisService redisService;
    private final RateLimitFailurePolicy failurePolicy;
    private final Clock clock;

    public RedisSlidingWindowRateLimiter(IRedisService redisService, RateLimitFailurePolicy failurePolicy, Clock clock) {
        this.redisService = redisService;
        this.failurePolicy = failurePolicy;
        this.clock = clock;
        log.info("Redis sliding window rate limiter initialized (failurePolicy={})", failurePolicy);
    }

    @Override
    public Mono<RateLimitDecision> check(String subjectKey, RateLimitRule rule) {
        long nowMs = clock.millis();
        long windowMs = rule.getWindowSeconds() * 1000L;
        long resetAt = nowMs / 1000 + rule.getWindowSeconds();
        String key = Keys.rateLimit(subjectKey, rule.getWindowSeconds());
        String member = nowMs + ":" + UUID.randomUUID();

        return redisService.slidingWindowCount(key, nowMs, windowMs, rule.getWindowSeconds() + 1L, member)
                .map(count -> {
                    long remaining = rule.getRequestsAllowed() - count - 1;
                    if (count < rule.getRequestsAllowed()) {
                        return RateLimitDecision.allow(rule, remaining, resetAt);
                    }
                    log.debug("Rate limit exceeded for {} ({} in {}s)", subjectKey, count, rule.getWindowSeconds());
                    return RateLimitDecision.reject(rule, 0, resetAt);
                })
                .onErrorResume(err -> Mono.just(fallback(subjectKey, rule, resetAt, err)));
    }

    private RateLimitDecision fallback(String subjectKey, RateLimitRule rule, long resetAt, Throwable err) {
        if (failurePolicy == RateLimitFailurePolicy.FAIL_CLOSED) {
            log.warn("Rate limit check for {} failed, rejecting request: {}", subjectKey, err.getMessage());
            return RateLimitDecision.reject(rule, 0, resetAt);
        }
        log.warn("Rate limit check for {} failed, allowing request: {}", subjectKey, err.getMessage());
        return RateLimitDecision.unchecked(rule, resetAt);
    }

    public RateLimitFailurePolicy getFailurePolicy() {
        return failurePolicy;
    }
}
