package io.meshroute.core.ratelimit;

/**
 * What a shared-store limiter answers when the store cannot be reached.
 */
public enum RateLimitFailurePolicy {
    /**
     * Allow the request.
     */
    FAIL_OPEN,

    /**
     * Reject the request.
     */
    FAIL_CLOSED
}
