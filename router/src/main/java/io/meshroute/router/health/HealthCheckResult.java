package io.meshroute.router.health;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Result of one health probe, also the JSON document published as
 * {@code instance_health:{id}}.
 */
@Value
@Builder(toBuilder = true)
public class HealthCheckResult {
    /**
     * Probed component, the instance id for instance probes.
     */
    String component;

    HealthStatus status;
    String message;
    Instant timestamp;

    /**
     * Probe latency in milliseconds.
     */
    double responseTimeMs;

    Map<String, Object> details;

    /**
     * Failure description, null for answered probes.
     */
    String error;
}
