package io.meshroute.core.metrics;

/**
 * Micrometer metric names used across the router.
 * <p>
 * <b>Naming convention:</b> {@code meshroute.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Routing decisions.
     * <p>
     * Tags: outcome (routed/no_healthy_instance/circuit_open/rate_limited)
     * </p>
     */
    public static final String ROUTER_REQUESTS_TOTAL = "meshroute.router.requests.total";

    /**
     * Timer: Upstream response time reported on request completion.
     * <p>
     * Tags: result (success/failure)
     * </p>
     */
    public static final String ROUTER_RESPONSE_LATENCY = "meshroute.router.response.latency";

    /**
     * Gauge: Registered instances.
     */
    public static final String REGISTRY_INSTANCES = "meshroute.registry.instances";

    /**
     * Gauge: Registered instances currently healthy.
     */
    public static final String REGISTRY_HEALTHY_INSTANCES = "meshroute.registry.instances.healthy";

    /**
     * Counter: Circuit breaker state transitions.
     * <p>
     * Tags: instance, state (target state)
     * </p>
     */
    public static final String BREAKER_TRANSITIONS_TOTAL = "meshroute.breaker.transitions.total";

    /**
     * Counter: Rate limit checks.
     * <p>
     * Tags: result (allowed/rejected)
     * </p>
     */
    public static final String RATELIMIT_CHECKS_TOTAL = "meshroute.ratelimit.checks.total";

    /**
     * Counter: Health probes executed.
     * <p>
     * Tags: status (healthy/degraded/unhealthy)
     * </p>
     */
    public static final String HEALTH_PROBES_TOTAL = "meshroute.health.probes.total";

    /**
     * Timer: Health probe round trip.
     */
    public static final String HEALTH_PROBE_LATENCY = "meshroute.health.probe.latency";

    /**
     * Counter: Scaling decisions made.
     * <p>
     * Tags: action (scale_out/scale_in/none)
     * </p>
     */
    public static final String SCALER_DECISIONS_TOTAL = "meshroute.scaler.decisions.total";

    /**
     * Counter: Failed provisioning or deprovisioning calls.
     */
    public static final String SCALER_FAILURES_TOTAL = "meshroute.scaler.failures.total";
}
