package io.meshroute.router.scale;

import io.meshroute.core.model.InstanceDescriptor;
import io.meshroute.core.model.ProvisionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Provisioner for fleets managed outside the router: accepts every request as-is
 * and only logs it.
 */
public class LoggingInstanceProvisioner implements InstanceProvisioner {
    private static final Logger log = LoggerFactory.getLogger(LoggingInstanceProvisioner.class);

    @Override
    public Mono<InstanceDescriptor> provisionInstance(ProvisionRequest request) {
        log.info("Provision requested: {} at {}:{} (weight={})",
                request.getInstanceId(), request.getHost(), request.getPort(), request.getWeight());
        return Mono.just(InstanceDescriptor.builder()
                .id(request.getInstanceId())
                .host(request.getHost())
                .port(request.getPort())
                .weight(request.getWeight())
                .build());
    }

    @Override
    public Mono<Void> deprovisionInstance(String instanceId) {
        log.info("Deprovision requested: {}", instanceId);
        return Mono.empty();
    }
}
