package io.meshroute.core.ratelimit;

/**
 * What a rate limit rule is keyed on.
 */
public enum RateLimitScope {
    GLOBAL,
    USER,
    IP,
    API_KEY
}
