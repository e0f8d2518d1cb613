package io.meshroute.core.ratelimit;

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * Immutable rate limiting rule: {@code requestsAllowed} per {@code windowSeconds}.
 */
@Value
public class RateLimitRule {
    int requestsAllowed;
    int windowSeconds;

    /**
     * Burst allowance; defaults to twice {@link #requestsAllowed}.
     */
    int burstLimit;
    RateLimitScope scope;

    public RateLimitRule(int requestsAllowed, int windowSeconds, Integer burstLimit, RateLimitScope scope) {
        Preconditions.checkArgument(requestsAllowed > 0, "requestsAllowed must be positive, got %s", requestsAllowed);
        Preconditions.checkArgument(windowSeconds > 0, "windowSeconds must be positive, got %s", windowSeconds);
        Preconditions.checkArgument(burstLimit == null || burstLimit > 0, "burstLimit must be positive, got %s", burstLimit);
        this.requestsAllowed = requestsAllowed;
        this.windowSeconds = windowSeconds;
        this.burstLimit = burstLimit != null ? burstLimit : requestsAllowed * 2;
        this.scope = scope != null ? scope : RateLimitScope.GLOBAL;
    }

    public RateLimitRule(int requestsAllowed, int windowSeconds, RateLimitScope scope) {
        this(requestsAllowed, windowSeconds, null, scope);
    }

    public static RateLimitRule of(int requestsAllowed, int windowSeconds) {
        return new RateLimitRule(requestsAllowed, windowSeconds, null, RateLimitScope.GLOBAL);
    }

    /**
     * Token refill rate in tokens per second.
     */
    public double refillRatePerSecond() {
        return (double) requestsAllowed / windowSeconds;
    }
}
