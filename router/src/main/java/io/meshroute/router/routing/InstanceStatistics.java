package io.meshroute.router.routing;

import io.meshroute.core.breaker.CircuitState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of one instance.
 */
@Value
@Builder
public class InstanceStatistics {
    String id;
    String url;
    int weight;
    boolean healthy;
    boolean draining;
    double healthScore;
    int activeConnections;
    int errorCount;
    double averageResponseTime;
    CircuitState circuitState;
    Instant lastHealthCheck;
}
