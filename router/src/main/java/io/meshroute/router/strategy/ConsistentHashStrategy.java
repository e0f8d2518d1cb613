package io.meshroute.router.strategy;

import io.meshroute.core.hash.ConsistentHashRing;
import io.meshroute.core.model.RequestContext;
import io.meshroute.core.model.ServiceInstance;
import io.meshroute.router.registry.RegistryListener;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Session affinity through a consistent hash ring.
 * <p>
 * The routing key is the user id, else the session id, else {@code "default"}.
 * When the owning instance is not a candidate the ring is walked clockwise to the
 * next candidate; nothing is returned only when every ring member was rejected.
 * Ring membership follows the registry through {@link RegistryListener}.
 * </p>
 */
public class ConsistentHashStrategy implements LoadBalancingStrategy, RegistryListener {
    private volatile ConsistentHashRing ring;

    public ConsistentHashStrategy(int replicas) {
        this.ring = ConsistentHashRing.empty(replicas);
    }

    public ConsistentHashStrategy() {
        this(ConsistentHashRing.DEFAULT_REPLICAS);
    }

    @Override
    public Optional<ServiceInstance> select(List<ServiceInstance> candidates, RequestContext context) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        Map<String, ServiceInstance> byId = candidates.stream()
                .collect(Collectors.toMap(ServiceInstance::getId, Function.identity(), (a, b) -> a));
        String routingKey = (context != null ? context : RequestContext.EMPTY).routingKey();

        return ring.successor(routingKey, byId::containsKey).map(byId::get);
    }

    public synchronized void addInstance(String instanceId) {
        ring = ring.withInstance(instanceId);
    }

    public synchronized void removeInstance(String instanceId) {
        ring = ring.withoutInstance(instanceId);
    }

    @Override
    public void onRegistered(ServiceInstance instance) {
        addInstance(instance.getId());
    }

    @Override
    public void onDeregistered(ServiceInstance instance) {
        removeInstance(instance.getId());
    }

    public ConsistentHashRing getRing() {
        return ring;
    }

    @Override
    public StrategyType type() {
        return StrategyType.CONSISTENT_HASH;
    }
}
