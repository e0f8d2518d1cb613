package io.meshroute.router.health;

/**
 * Health of a component, ordered from best to worst for aggregation.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,

    /**
     * No probe result yet.
     */
    UNKNOWN;

    /**
     * Returns the worse of two statuses; {@link #UNKNOWN} loses to any observed status.
     */
    public HealthStatus worst(HealthStatus other) {
        if (this == UNKNOWN) {
            return other;
        }
        if (other == UNKNOWN) {
            return this;
        }
        return other.ordinal() > ordinal() ? other : this;
    }
}
