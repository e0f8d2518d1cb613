package io.meshroute.router.scale;

import lombok.Builder;
import lombok.Value;

/**
 * Fleet aggregates evaluated by one auto-scaler tick.
 */
@Value
@Builder
public class FleetSnapshot {
    int healthyCount;

    /**
     * Mean of the healthy instances' average response times, seconds.
     */
    double averageResponseTime;

    /**
     * Failed share of the requests completed since the previous tick.
     */
    double errorRate;

    int activeConnections;

    /**
     * CPU percentage estimated from response time and connections.
     */
    double estimatedCpu;

    /**
     * {@code min(100, 20 + min(50, avgResponseTime * 25) + min(30, activeConnections * 2))}
     */
    public static double estimateCpu(double averageResponseTime, int activeConnections) {
        double responseLoad = Math.min(50.0, averageResponseTime * 25.0);
        double connectionLoad = Math.min(30.0, activeConnections * 2.0);
        return Math.min(100.0, 20.0 + responseLoad + connectionLoad);
    }
}
