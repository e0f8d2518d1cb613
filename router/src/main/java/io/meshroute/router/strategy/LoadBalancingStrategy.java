package io.meshroute.router.strategy;

import io.meshroute.core.model.RequestContext;
import io.meshroute.core.model.ServiceInstance;

import java.util.List;
import java.util.Optional;

/**
 * Picks one instance among routing candidates.
 * <p>
 * Candidates are already filtered by the router (healthy, not draining, circuit
 * permitting). An empty list, or no acceptable candidate, yields
 * {@link Optional#empty()}; strategies never throw for lack of instances.
 * </p>
 */
public interface LoadBalancingStrategy {

    Optional<ServiceInstance> select(List<ServiceInstance> candidates, RequestContext context);

    StrategyType type();
}
