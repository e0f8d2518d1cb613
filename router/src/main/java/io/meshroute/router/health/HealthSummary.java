package io.meshroute.router.health;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregate of one component's probe results over a time window.
 */
@Value
@Builder
public class HealthSummary {
    String component;
    int totalChecks;
    int healthyChecks;

    /**
     * Fraction of checks that were HEALTHY, 0 without checks.
     */
    double availability;

    double averageResponseTimeMs;
    HealthStatus lastStatus;
}
