package io.meshroute.core.ratelimit;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * In-process rate limiter with one {@link TokenBucket} per {@code subjectKey:windowSeconds}.
 * <p>
 * Buckets idle for longer than {@code idleEviction} are dropped; a dropped bucket
 * would have refilled to capacity anyway once idle for a full window.
 * </p>
 */
public class LocalTokenBucketRateLimiter implements RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(LocalTokenBucketRateLimiter.class);

    private final Clock clock;
    private final Cache<String, TokenBucket> buckets;

    public LocalTokenBucketRateLimiter(Clock clock, Duration idleEviction) {
        this.clock = clock;
        this.buckets = CacheBuilder.newBuilder()
                .expireAfterAccess(idleEviction)
                .build();
    }

    public LocalTokenBucketRateLimiter(Clock clock) {
        this(clock, Duration.ofHours(1));
    }

    @Override
    public Mono<RateLimitDecision> check(String subjectKey, RateLimitRule rule) {
        return Mono.fromSupplier(() -> checkNow(subjectKey, rule));
    }

    /**
     * Synchronous variant of {@link #check}.
     */
    public RateLimitDecision checkNow(String subjectKey, RateLimitRule rule) {
        String bucketKey = subjectKey + ":" + rule.getWindowSeconds();
        TokenBucket bucket = buckets.asMap().computeIfAbsent(bucketKey, k -> TokenBucket.forRule(rule, clock));

        boolean allowed = bucket.tryConsume();
        long remaining = (long) Math.floor(bucket.availableTokens());
        long resetAt = clock.millis() / 1000 + rule.getWindowSeconds();

        if (allowed) {
            return RateLimitDecision.allow(rule, remaining, resetAt);
        }
        log.debug("Rate limit exceeded for {} ({} per {}s)", subjectKey, rule.getRequestsAllowed(), rule.getWindowSeconds());
        return RateLimitDecision.reject(rule, remaining, resetAt);
    }

    public long bucketCount() {
        return buckets.size();
    }
}
