package io.meshroute.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Immutable description of a provisioned backend instance.
 * <p>
 * Returned by the provisioning hook when the auto-scaler adds capacity;
 * the router registers a {@link ServiceInstance} built from it.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class InstanceDescriptor {
    /**
     * Unique identifier for this instance (e.g., container name or UUID).
     */
    String id;

    String host;

    int port;

    /**
     * Weight for weighted strategies. Must be at least 1.
     */
    @Builder.Default
    int weight = 1;
}
