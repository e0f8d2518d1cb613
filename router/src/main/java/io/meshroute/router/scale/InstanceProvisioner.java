package io.meshroute.router.scale;

import io.meshroute.core.model.InstanceDescriptor;
import io.meshroute.core.model.ProvisionRequest;
import reactor.core.publisher.Mono;

/**
 * Starts and stops backend instances on behalf of the auto-scaler.
 */
public interface InstanceProvisioner {

    /**
     * @return Mono of the started instance, which may differ from the request
     * (e.g. a port chosen by the platform)
     */
    Mono<InstanceDescriptor> provisionInstance(ProvisionRequest request);

    Mono<Void> deprovisionInstance(String instanceId);
}
