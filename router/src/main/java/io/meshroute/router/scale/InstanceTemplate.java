package io.meshroute.router.scale;

import lombok.Builder;
import lombok.Value;

/**
 * Where newly provisioned instances live: {@code host}, ports counted up from
 * {@code basePort}, and their routing weight.
 */
@Value
@Builder(toBuilder = true)
public class InstanceTemplate {
    @Builder.Default
    String host = "localhost";
    @Builder.Default
    int basePort = 8080;
    @Builder.Default
    int weight = 1;
}
