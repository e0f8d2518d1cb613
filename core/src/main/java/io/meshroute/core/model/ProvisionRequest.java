package io.meshroute.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Parameters handed to the provisioning hook for a scale-up.
 */
@Value
@Builder
public class ProvisionRequest {
    String instanceId;
    String host;
    int port;
    int weight;
}
