package io.meshroute.router.strategy;

import io.meshroute.core.model.RequestContext;
import io.meshroute.core.model.ServiceInstance;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cycles through the current candidate list with a shared counter.
 */
public class RoundRobinStrategy implements LoadBalancingStrategy {
    private final AtomicLong counter = new AtomicLong();

    @Override
    public Optional<ServiceInstance> select(List<ServiceInstance> candidates, RequestContext context) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        int index = (int) Math.floorMod(counter.getAndIncrement(), (long) candidates.size());
        return Optional.of(candidates.get(index));
    }

    @Override
    public StrategyType type() {
        return StrategyType.ROUND_ROBIN;
    }
}
