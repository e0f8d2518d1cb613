package io.meshroute.router.health;

/**
 * Maps probe latency and outstanding errors to a health score.
 */
public final class HealthScorer {
    static final double HEALTHY_FLOOR = 0.7;
    static final double NON_SUCCESS_SCORE = 0.1;
    static final double FAILURE_SCORE = 0.0;

    private HealthScorer() {
    }

    /**
     * Latency tier: &lt;100ms 1.0, &lt;500ms 0.9, &lt;1000ms 0.7, &lt;2000ms 0.5, else 0.3.
     */
    public static double latencyTier(double latencyMs) {
        if (latencyMs < 100) {
            return 1.0;
        }
        if (latencyMs < 500) {
            return 0.9;
        }
        if (latencyMs < 1000) {
            return 0.7;
        }
        if (latencyMs < 2000) {
            return 0.5;
        }
        return 0.3;
    }

    public static double errorDecay(int errorCount) {
        return Math.max(0.1, 1.0 - errorCount / 50.0);
    }

    public static double score(double latencyMs, int errorCount) {
        return latencyTier(latencyMs) * errorDecay(errorCount);
    }

    /**
     * Status of an answered 2xx probe.
     */
    public static HealthStatus statusOf(double score) {
        return score >= HEALTHY_FLOOR ? HealthStatus.HEALTHY : HealthStatus.DEGRADED;
    }
}
