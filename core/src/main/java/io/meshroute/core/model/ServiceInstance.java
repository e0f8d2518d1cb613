package io.meshroute.core.model;

import com.google.common.base.Preconditions;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A backend instance that requests can be routed to.
 * <p>
 * Identity (id, host, port, weight) is fixed at construction. Health and load state
 * is mutated concurrently by the request path (connections, response times, errors)
 * and by the health probe (score, errors); every field is atomic or volatile.
 * </p>
 */
public class ServiceInstance {
    private static final double HEALTHY_SCORE_FLOOR = 0.5;
    private static final int MAX_HEALTHY_ERRORS = 10;

    @Getter
    private final String id;
    @Getter
    private final String host;
    @Getter
    private final int port;
    @Getter
    private final int weight;

    private final AtomicInteger activeConnections = new AtomicInteger();
    private final AtomicInteger errorCount = new AtomicInteger();
    private final ResponseTimeWindow responseTimes = new ResponseTimeWindow();

    private volatile double healthScore = 1.0;
    private volatile Instant lastHealthCheck;
    private volatile boolean draining;

    public ServiceInstance(String id, String host, int port, int weight) {
        Preconditions.checkArgument(id != null && !id.isEmpty(), "instance id must not be empty");
        Preconditions.checkArgument(weight >= 1, "weight must be >= 1, got %s", weight);
        this.id = id;
        this.host = host;
        this.port = port;
        this.weight = weight;
    }

    public ServiceInstance(String id, String host, int port) {
        this(id, host, port, 1);
    }

    public static ServiceInstance from(InstanceDescriptor descriptor) {
        return new ServiceInstance(descriptor.getId(), descriptor.getHost(), descriptor.getPort(), descriptor.getWeight());
    }

    public String url() {
        return "http://" + host + ":" + port;
    }

    /**
     * An instance is eligible for routing when its score is above 0.5 and it has
     * fewer than 10 outstanding errors.
     */
    public boolean isHealthy() {
        return healthScore > HEALTHY_SCORE_FLOOR && errorCount.get() < MAX_HEALTHY_ERRORS;
    }

    public double getHealthScore() {
        return healthScore;
    }

    public void setHealthScore(double healthScore) {
        this.healthScore = Math.max(0.0, Math.min(1.0, healthScore));
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    public int acquireConnection() {
        return activeConnections.incrementAndGet();
    }

    /**
     * Decrements active connections, never below zero.
     */
    public int releaseConnection() {
        return activeConnections.updateAndGet(current -> Math.max(0, current - 1));
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public int addErrors(int delta) {
        return errorCount.addAndGet(delta);
    }

    /**
     * Moves the error counter one step toward zero.
     */
    public int decayErrors() {
        return errorCount.updateAndGet(current -> Math.max(0, current - 1));
    }

    public void recordResponseTime(double responseTimeSeconds) {
        responseTimes.record(responseTimeSeconds);
    }

    /**
     * @return mean of the response time window in seconds, 0.0 without samples
     */
    public double getAverageResponseTime() {
        return responseTimes.average();
    }

    public ResponseTimeWindow getResponseTimes() {
        return responseTimes;
    }

    public Instant getLastHealthCheck() {
        return lastHealthCheck;
    }

    public void setLastHealthCheck(Instant lastHealthCheck) {
        this.lastHealthCheck = lastHealthCheck;
    }

    public boolean isDraining() {
        return draining;
    }

    public void setDraining(boolean draining) {
        this.draining = draining;
    }

    @Override
    public String toString() {
        return String.format("ServiceInstance{id='%s', url=%s, weight=%d, health=%.2f, conn=%d, errors=%d}",
                id, url(), weight, healthScore, activeConnections.get(), errorCount.get());
    }
}
