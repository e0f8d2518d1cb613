package io.meshroute.router.registry;

import io.meshroute.core.model.ServiceInstance;
import io.netty.util.internal.PlatformDependent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Registry of backend instances keyed by id.
 * <p>
 * Iteration order is stable (registration order is not guaranteed); listings are
 * snapshots safe to use while the registry changes.
 * </p>
 */
public class ServiceRegistry {
    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final Map<String, ServiceInstance> instances = PlatformDependent.newConcurrentHashMap();
    private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(RegistryListener listener) {
        listeners.add(listener);
    }

    /**
     * Registers an instance. An instance already registered under the same id is replaced.
     */
    public void register(ServiceInstance instance) {
        ServiceInstance previous = instances.put(instance.getId(), instance);
        if (previous != null) {
            log.warn("Instance {} re-registered, replacing {}", instance.getId(), previous.url());
            listeners.forEach(l -> l.onDeregistered(previous));
        }
        listeners.forEach(l -> l.onRegistered(instance));
        log.info("Registered instance {} at {} (weight={})", instance.getId(), instance.url(), instance.getWeight());
    }

    /**
     * @return the removed instance, empty if the id was unknown
     */
    public Optional<ServiceInstance> deregister(String instanceId) {
        ServiceInstance removed = instances.remove(instanceId);
        if (removed == null) {
            log.debug("Deregister of unknown instance {}", instanceId);
            return Optional.empty();
        }
        listeners.forEach(l -> l.onDeregistered(removed));
        log.info("Deregistered instance {}", instanceId);
        return Optional.of(removed);
    }

    public Optional<ServiceInstance> get(String instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    public List<ServiceInstance> listAll() {
        return new ArrayList<>(instances.values());
    }

    public List<ServiceInstance> listHealthy() {
        return instances.values().stream()
                .filter(ServiceInstance::isHealthy)
                .collect(Collectors.toList());
    }

    public int size() {
        return instances.size();
    }

    public long healthyCount() {
        return instances.values().stream().filter(ServiceInstance::isHealthy).count();
    }

    /**
     * Removes every instance, notifying listeners.
     */
    public void clear() {
        listAll().forEach(instance -> deregister(instance.getId()));
    }
}
