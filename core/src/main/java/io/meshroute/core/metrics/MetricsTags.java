package io.meshroute.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for routing outcome.
     */
    public static final String OUTCOME = "outcome";

    /**
     * Tag key for instance identifier.
     */
    public static final String INSTANCE = "instance";

    /**
     * Tag key for success/failure or allowed/rejected.
     */
    public static final String RESULT = "result";

    /**
     * Tag key for breaker state or probe status.
     */
    public static final String STATE = "state";

    public static final String STATUS = "status";

    /**
     * Tag key for scaling action.
     */
    public static final String ACTION = "action";
}
