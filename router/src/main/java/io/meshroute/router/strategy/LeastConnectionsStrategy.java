package io.meshroute.router.strategy;

import io.meshroute.core.model.RequestContext;
import io.meshroute.core.model.ServiceInstance;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Routes to the candidate with the fewest active connections; ties go to the earliest candidate.
 */
public class LeastConnectionsStrategy implements LoadBalancingStrategy {

    @Override
    public Optional<ServiceInstance> select(List<ServiceInstance> candidates, RequestContext context) {
        return candidates.stream().min(Comparator.comparingInt(ServiceInstance::getActiveConnections));
    }

    @Override
    public StrategyType type() {
        return StrategyType.LEAST_CONNECTIONS;
    }
}
