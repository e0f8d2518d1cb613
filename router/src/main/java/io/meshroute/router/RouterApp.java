package io.meshroute.router;

import io.meshroute.core.breaker.CircuitBreakerRegistry;
import io.meshroute.core.metrics.MetricsNames;
import io.meshroute.core.metrics.MetricsTags;
import io.meshroute.core.model.ServiceInstance;
import io.meshroute.core.ratelimit.LocalTokenBucketRateLimiter;
import io.meshroute.core.ratelimit.RateLimiter;
import io.meshroute.router.config.RouterConfig;
import io.meshroute.router.health.HealthProbe;
import io.meshroute.router.health.HttpProbeClient;
import io.meshroute.router.redis.IRedisService;
import io.meshroute.router.redis.RedisService;
import io.meshroute.router.redis.RedisSlidingWindowRateLimiter;
import io.meshroute.router.registry.ServiceRegistry;
import io.meshroute.router.routing.Router;
import io.meshroute.router.scale.AutoScaler;
import io.meshroute.router.scale.LoggingInstanceProvisioner;
import io.meshroute.router.strategy.LoadBalancingStrategy;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.logging.LoggingMeterRegistry;
import io.micrometer.core.instrument.logging.LoggingRegistryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

public class RouterApp {
    private static final Logger log = LoggerFactory.getLogger(RouterApp.class);

    public static void main(String[] args) throws InterruptedException {
        RouterConfig config = RouterConfig.fromEnv();
        java.time.Clock clock = java.time.Clock.systemUTC();

        log.info("Starting router {}", config.getNodeId());
        log.info("  Strategy: {}", config.getStrategy());
        log.info("  Redis: {}", config.isRedisEnabled() ? config.getRedisUrl() : "disabled");
        log.info("  Rate limit rules: {}", config.getRateLimitRules().size());

        // Setup metrics
        MeterRegistry meterRegistry = new LoggingMeterRegistry(LoggingRegistryConfig.DEFAULT, Clock.SYSTEM);
        meterRegistry.config().commonTags("node", config.getNodeId());

        // Initialize components
        IRedisService redisService = config.isRedisEnabled() ? new RedisService(config.getRedisUrl()) : null;
        RateLimiter rateLimiter = redisService != null
            ? new RedisSlidingWindowRateLimiter(redisService, config.getRateLimitFailurePolicy(), clock)
            : new LocalTokenBucketRateLimiter(clock);

        ServiceRegistry registry = new ServiceRegistry();
        config.getInitialInstances().forEach(descriptor -> registry.register(ServiceInstance.from(descriptor)));

        CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(config.getBreakerSettings(), clock,
            (targetId, from, to) -> meterRegistry.counter(MetricsNames.BREAKER_TRANSITIONS_TOTAL,
                MetricsTags.INSTANCE, targetId, MetricsTags.STATE, to.name().toLowerCase()).increment());

        LoadBalancingStrategy strategy = config.getStrategy().create(config.getHashReplicas());
        Router router = new Router(registry, strategy, breakers, rateLimiter,
            config.getRateLimitRules(), meterRegistry);

        HealthProbe healthProbe = new HealthProbe(registry, new HttpProbeClient(config.getHealthPath()),
            config.getProbeInterval(), config.getProbeTimeout(), clock, meterRegistry, redisService);

        AutoScaler autoScaler = config.isAutoScalingEnabled()
            ? new AutoScaler(router, new LoggingInstanceProvisioner(), config.getScalingPolicy(),
                config.getInstanceTemplate(), clock, meterRegistry)
            : null;

        RouterRuntime runtime = new RouterRuntime(router, healthProbe, autoScaler, redisService,
            config.getStatsPublishInterval());
        runtime.start();

        log.info("Router is ready with {} instances", registry.size());

        CountDownLatch stopped = new CountDownLatch(1);
        handleShutDown(runtime, redisService, meterRegistry, stopped);
        stopped.await();
    }

    private static void handleShutDown(
        RouterRuntime runtime,
        IRedisService redisService,
        MeterRegistry meterRegistry,
        CountDownLatch stopped
    ) {
        // Graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            runtime.stop();

            if (redisService != null) {
                redisService.close();
            }

            meterRegistry.close();

            log.info("Shutdown complete");
            stopped.countDown();
        }));
    }
}
