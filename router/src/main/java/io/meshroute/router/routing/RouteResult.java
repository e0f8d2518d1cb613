package io.meshroute.router.routing;

import io.meshroute.core.model.ServiceInstance;
import lombok.Value;
import lombok.With;

import java.util.Collections;
import java.util.Map;

/**
 * Outcome of a routing attempt.
 * <p>
 * Only {@link Outcome#ROUTED} carries an instance; callers must report the request
 * back through {@link Router#completeRequest} once it finishes.
 * </p>
 */
@Value
@With
public class RouteResult {
    Outcome outcome;
    ServiceInstance instance;

    /**
     * Rate limit headers of the admission check, empty when no rule was evaluated.
     */
    Map<String, String> headers;

    public static RouteResult routed(ServiceInstance instance) {
        return new RouteResult(Outcome.ROUTED, instance, Collections.emptyMap());
    }

    public static RouteResult noHealthyInstance() {
        return new RouteResult(Outcome.NO_HEALTHY_INSTANCE, null, Collections.emptyMap());
    }

    public static RouteResult circuitOpen() {
        return new RouteResult(Outcome.CIRCUIT_OPEN, null, Collections.emptyMap());
    }

    public static RouteResult rateLimited(Map<String, String> headers) {
        return new RouteResult(Outcome.RATE_LIMITED, null, headers);
    }

    public boolean isRouted() {
        return outcome == Outcome.ROUTED;
    }

    public enum Outcome {
        ROUTED,

        /**
         * No instance is healthy and out of drain.
         */
        NO_HEALTHY_INSTANCE,

        /**
         * Healthy instances exist but every circuit breaker rejects calls.
         */
        CIRCUIT_OPEN,

        RATE_LIMITED
    }
}
