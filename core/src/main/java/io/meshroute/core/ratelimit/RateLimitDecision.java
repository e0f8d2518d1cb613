package io.meshroute.core.ratelimit;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a rate limit check together with the response headers describing it.
 */
@Value
public class RateLimitDecision {
    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";
    public static final String RETRY_AFTER_HEADER = "Retry-After";

    boolean allowed;
    Map<String, String> headers;

    private RateLimitDecision(boolean allowed, Map<String, String> headers) {
        this.allowed = allowed;
        this.headers = Collections.unmodifiableMap(headers);
    }

    /**
     * @param rule              Rule that was evaluated
     * @param remaining         Requests left in the current window (clamped at 0)
     * @param resetEpochSeconds When the window resets
     */
    public static RateLimitDecision allow(RateLimitRule rule, long remaining, long resetEpochSeconds) {
        return new RateLimitDecision(true, baseHeaders(rule, remaining, resetEpochSeconds));
    }

    public static RateLimitDecision reject(RateLimitRule rule, long remaining, long resetEpochSeconds) {
        Map<String, String> headers = baseHeaders(rule, remaining, resetEpochSeconds);
        headers.put(RETRY_AFTER_HEADER, String.valueOf(rule.getWindowSeconds()));
        return new RateLimitDecision(false, headers);
    }

    /**
     * Decision used when the limiter backend is unreachable and the policy allows traffic.
     */
    public static RateLimitDecision unchecked(RateLimitRule rule, long resetEpochSeconds) {
        return allow(rule, rule.getRequestsAllowed(), resetEpochSeconds);
    }

    private static Map<String, String> baseHeaders(RateLimitRule rule, long remaining, long resetEpochSeconds) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(LIMIT_HEADER, String.valueOf(rule.getRequestsAllowed()));
        headers.put(REMAINING_HEADER, String.valueOf(Math.max(0, remaining)));
        headers.put(RESET_HEADER, String.valueOf(resetEpochSeconds));
        return headers;
    }

    public Integer getRetryAfterSeconds() {
        String value = headers.get(RETRY_AFTER_HEADER);
        return value != null ? Integer.valueOf(value) : null;
    }

    public long getRemaining() {
        return Long.parseLong(headers.get(REMAINING_HEADER));
    }
}
