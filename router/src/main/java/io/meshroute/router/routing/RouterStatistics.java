package io.meshroute.router.routing;

import io.meshroute.router.strategy.StrategyType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Router-wide aggregates, published to the shared store as {@code router:stats}.
 */
@Value
@Builder
public class RouterStatistics {
    StrategyType strategy;
    int totalInstances;
    long healthyInstances;
    long openCircuits;

    /**
     * Requests handed to an instance since start.
     */
    long totalRequests;

    long completedRequests;
    long totalErrors;

    /**
     * {@code totalErrors / completedRequests}, 0 before the first completion.
     */
    double errorRate;

    /**
     * Mean response time in seconds over all completed requests.
     */
    double averageResponseTime;

    int activeConnections;
    List<InstanceStatistics> instances;
}
