package io.meshroute.router.health;

/**
 * Callback for every probe result, e.g. to trigger failover.
 */
@FunctionalInterface
public interface HealthCheckListener {

    void onResult(HealthCheckResult result);
}
