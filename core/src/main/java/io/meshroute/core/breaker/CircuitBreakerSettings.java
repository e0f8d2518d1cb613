package io.meshroute.core.breaker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Thresholds shared by every breaker of a router.
 */
@Value
@Builder(toBuilder = true)
public class CircuitBreakerSettings {
    public static final CircuitBreakerSettings DEFAULTS = CircuitBreakerSettings.builder().build();

    /**
     * Consecutive failures that open a closed breaker.
     */
    @Builder.Default
    int failureThreshold = 5;

    /**
     * Time an open breaker rejects calls before granting a trial.
     */
    @Builder.Default
    Duration openTimeout = Duration.ofSeconds(60);
}
