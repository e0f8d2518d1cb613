package io.meshroute.router.strategy;

import io.meshroute.core.model.RequestContext;
import io.meshroute.core.model.ServiceInstance;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Prefers fast, lightly loaded, healthy instances.
 * <p>
 * {@code score = avgResponseTime * (1 + 0.1 * activeConnections) / healthScore}, lowest wins.
 * Instances without samples are scored with 0.5s.
 * </p>
 */
public class ResponseTimeStrategy implements LoadBalancingStrategy {
    static final double UNPROVEN_RESPONSE_TIME = 0.5;
    private static final double CONNECTION_PENALTY = 0.1;

    @Override
    public Optional<ServiceInstance> select(List<ServiceInstance> candidates, RequestContext context) {
        return candidates.stream().min(Comparator.comparingDouble(ResponseTimeStrategy::score));
    }

    static double score(ServiceInstance instance) {
        double avgResponse = instance.getResponseTimes().isEmpty()
                ? UNPROVEN_RESPONSE_TIME
                : instance.getAverageResponseTime();
        double connectionsFactor = 1 + instance.getActiveConnections() * CONNECTION_PENALTY;
        double healthFactor = Math.max(instance.getHealthScore(), Double.MIN_VALUE);
        return avgResponse * connectionsFactor / healthFactor;
    }

    @Override
    public StrategyType type() {
        return StrategyType.RESPONSE_TIME;
    }
}
