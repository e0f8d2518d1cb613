package io.meshroute.router.registry;

import io.meshroute.core.model.ServiceInstance;

/**
 * Observer of registry membership changes.
 */
public interface RegistryListener {

    void onRegistered(ServiceInstance instance);

    void onDeregistered(ServiceInstance instance);
}
