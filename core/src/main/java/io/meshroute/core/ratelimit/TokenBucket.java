package io.meshroute.core.ratelimit;

import java.time.Clock;

/**
 * Token bucket refilled lazily from elapsed time.
 * <p>
 * {@code tokens = min(capacity, tokens + elapsed * refillRate)} on every access;
 * tokens never exceed capacity and a failed consume leaves them untouched.
 * </p>
 */
public class TokenBucket {
    private final double capacity;
    private final double refillRatePerSecond;
    private final Clock clock;

    private double tokens;
    private long lastRefillMs;

    public TokenBucket(double capacity, double refillRatePerSecond, Clock clock) {
        if (capacity <= 0 || refillRatePerSecond <= 0) {
            throw new IllegalArgumentException("capacity and refill rate must be positive");
        }
        this.capacity = capacity;
        this.refillRatePerSecond = refillRatePerSecond;
        this.clock = clock;
        this.tokens = capacity;
        this.lastRefillMs = clock.millis();
    }

    public static TokenBucket forRule(RateLimitRule rule, Clock clock) {
        return new TokenBucket(rule.getRequestsAllowed(), rule.refillRatePerSecond(), clock);
    }

    /**
     * Refills, then takes {@code amount} tokens if available.
     *
     * @return true if the tokens were taken
     */
    public synchronized boolean tryConsume(int amount) {
        refill();
        if (tokens >= amount) {
            tokens -= amount;
            return true;
        }
        return false;
    }

    public boolean tryConsume() {
        return tryConsume(1);
    }

    /**
     * @return current token count after refilling
     */
    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = clock.millis();
        double elapsedSeconds = Math.max(0, now - lastRefillMs) / 1000.0;
        tokens = Math.min(capacity, tokens + elapsedSeconds * refillRatePerSecond);
        lastRefillMs = now;
    }

    public double getCapacity() {
        return capacity;
    }

    public double getRefillRatePerSecond() {
        return refillRatePerSecond;
    }
}
