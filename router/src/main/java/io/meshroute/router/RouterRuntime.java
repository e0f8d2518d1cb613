package io.meshroute.router;

import io.meshroute.core.redis.Keys;
import io.meshroute.core.util.JsonUtils;
import io.meshroute.router.health.HealthProbe;
import io.meshroute.router.redis.IRedisService;
import io.meshroute.router.registry.ServiceRegistry;
import io.meshroute.router.routing.Router;
import io.meshroute.router.scale.AutoScaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Owns the background tasks around a {@link Router}.
 * <p>
 * {@link #stop()} stops the scaler and the probe before the registry is cleared, so
 * no background task observes or mutates a half torn-down fleet. An instance the
 * scaler was draining at that point is drained and deprovisioned first.
 * </p>
 */
public class RouterRuntime {
    private static final Logger log = LoggerFactory.getLogger(RouterRuntime.class);

    static final long STATS_TTL_SECONDS = 300;

    private final Router router;
    private final HealthProbe healthProbe;
    private final AutoScaler autoScaler;
    private final IRedisService redisService;
    private final Duration statsPublishInterval;

    private Disposable statsPublisher;
    private boolean running;

    /**
     * @param autoScaler   Null when auto-scaling is disabled
     * @param redisService Null when no shared store is configured
     */
    public RouterRuntime(Router router, HealthProbe healthProbe, AutoScaler autoScaler,
                         IRedisService redisService, Duration statsPublishInterval) {
        this.router = router;
        this.healthProbe = healthProbe;
        this.autoScaler = autoScaler;
        this.redisService = redisService;
        this.statsPublishInterval = statsPublishInterval;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        healthProbe.start();
        if (autoScaler != null) {
            autoScaler.start();
        }
        if (redisService != null) {
            statsPublisher = Flux.interval(statsPublishInterval)
                    .onBackpressureDrop()
                    .concatMap(tick -> publishStatistics())
                    .subscribe();
        }
        running = true;
        log.info("Router runtime started (strategy={})", router.getStrategy().type());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        if (autoScaler != null) {
            autoScaler.stop();
        }
        healthProbe.stop();
        if (statsPublisher != null) {
            statsPublisher.dispose();
            statsPublisher = null;
        }

        ServiceRegistry registry = router.getRegistry();
        int remaining = registry.size();
        registry.clear();
        running = false;
        log.info("Router runtime stopped, released {} instances", remaining);
    }

    public synchronized boolean isRunning() {
        return running;
    }

    /**
     * Writes the current statistics to the shared store. Never errors.
     */
    public Mono<Void> publishStatistics() {
        if (redisService == null) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(router.getStatistics()))
                .flatMap(json -> redisService.setWithTtl(Keys.routerStats(), json, STATS_TTL_SECONDS))
                .doOnError(err -> log.warn("Failed to publish router statistics: {}", err.getMessage()))
                .onErrorResume(err -> Mono.empty());
    }
}
