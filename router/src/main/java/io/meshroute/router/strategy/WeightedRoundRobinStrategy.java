package io.meshroute.router.strategy;

import io.meshroute.core.model.RequestContext;
import io.meshroute.core.model.ServiceInstance;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Smooth weighted round-robin.
 * <p>
 * Each selection adds every candidate's static weight to its current weight, picks
 * the highest current weight and subtracts the total weight from the winner. Over
 * a cycle of {@code sum(weights)} selections each instance is picked exactly
 * {@code weight} times, interleaved rather than in bursts.
 * </p>
 */
public class WeightedRoundRobinStrategy implements LoadBalancingStrategy {
    private final Map<String, Integer> currentWeights = new HashMap<>();

    @Override
    public synchronized Optional<ServiceInstance> select(List<ServiceInstance> candidates, RequestContext context) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        int totalWeight = 0;
        ServiceInstance selected = null;
        int selectedWeight = Integer.MIN_VALUE;

        for (ServiceInstance instance : candidates) {
            int current = currentWeights.merge(instance.getId(), instance.getWeight(), Integer::sum);
            totalWeight += instance.getWeight();
            if (current > selectedWeight) {
                selected = instance;
                selectedWeight = current;
            }
        }

        currentWeights.merge(selected.getId(), -totalWeight, Integer::sum);
        return Optional.of(selected);
    }

    /**
     * Drops the accumulated weight of an instance that left the fleet.
     */
    public synchronized void forget(String instanceId) {
        currentWeights.remove(instanceId);
    }

    synchronized Map<String, Integer> currentWeights() {
        return new HashMap<>(currentWeights);
    }

    @Override
    public StrategyType type() {
        return StrategyType.WEIGHTED_ROUND_ROBIN;
    }
}
