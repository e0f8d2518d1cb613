package io.meshroute.router;

import io.meshroute.core.breaker.CircuitBreakerRegistry;
import io.meshroute.core.breaker.CircuitBreakerSettings;
import io.meshroute.core.model.ServiceInstance;
import io.meshroute.core.ratelimit.LocalTokenBucketRateLimiter;
import io.meshroute.router.health.HealthProbe;
import io.meshroute.router.redis.IRedisService;
import io.meshroute.router.registry.ServiceRegistry;
import io.meshroute.router.routing.Router;
import io.meshroute.router.scale.AutoScaler;
import io.meshroute.router.scale.InstanceProvisioner;
import io.meshroute.router.scale.InstanceTemplate;
import io.meshroute.router.scale.LoggingInstanceProvisioner;
import io.meshroute.router.scale.ScalingPolicy;
import io.meshroute.router.strategy.RoundRobinStrategy;
import io.meshroute.router.support.ManualClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RouterRuntimeTest {

    private ServiceRegistry registry;
    private Router router;
    private HealthProbe healthProbe;
    private AutoScaler autoScaler;

    @BeforeEach
    void setUp() {
        ManualClock clock = new ManualClock();
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        registry = new ServiceRegistry();
        registry.register(new ServiceInstance("a", "localhost", 8001));
        registry.register(new ServiceInstance("b", "localhost", 8002));
        router = new Router(registry, new RoundRobinStrategy(),
                new CircuitBreakerRegistry(CircuitBreakerSettings.DEFAULTS, clock),
                new LocalTokenBucketRateLimiter(clock), meterRegistry);
        healthProbe = new HealthProbe(registry, (instance, timeout) -> Mono.just(200),
                Duration.ofSeconds(30), Duration.ofSeconds(1), clock, meterRegistry);
        autoScaler = new AutoScaler(router, new LoggingInstanceProvisioner(), ScalingPolicy.DEFAULTS,
                InstanceTemplate.builder().build(), clock, meterRegistry);
    }

    @Test
    void stopHaltsBackgroundTasksAndReleasesRegistry() {
        RouterRuntime runtime = new RouterRuntime(router, healthProbe, autoScaler, null, Duration.ofSeconds(30));

        runtime.start();
        assertTrue(runtime.isRunning());
        assertTrue(healthProbe.isRunning());
        assertTrue(autoScaler.isRunning());

        runtime.stop();

        assertFalse(runtime.isRunning());
        assertFalse(healthProbe.isRunning());
        assertFalse(autoScaler.isRunning());
        assertEquals(0, registry.size());
    }

    @Test
    void stopFinishesScaleInThatWasDraining() throws InterruptedException {
        List<String> deprovisioned = new CopyOnWriteArrayList<>();
        InstanceProvisioner provisioner = new LoggingInstanceProvisioner() {
            @Override
            public Mono<Void> deprovisionInstance(String instanceId) {
                return Mono.fromRunnable(() -> deprovisioned.add(instanceId));
            }
        };
        ScalingPolicy policy = ScalingPolicy.DEFAULTS.toBuilder()
                .evaluationInterval(Duration.ofMillis(50))
                .drainTimeout(Duration.ofSeconds(5))
                .drainPollInterval(Duration.ofMillis(20))
                .build();
        AutoScaler scaler = new AutoScaler(router, provisioner, policy, InstanceTemplate.builder().build(),
                new ManualClock(), new SimpleMeterRegistry());
        ServiceInstance a = registry.get("a").orElseThrow();
        ServiceInstance b = registry.get("b").orElseThrow();
        a.acquireConnection();
        b.acquireConnection();
        RouterRuntime runtime = new RouterRuntime(router, healthProbe, scaler, null, Duration.ofSeconds(30));

        runtime.start();
        long deadline = System.currentTimeMillis() + 3000;
        while (!a.isDraining() && !b.isDraining() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        ServiceInstance draining = a.isDraining() ? a : b;
        assertTrue(draining.isDraining());
        Mono.delay(Duration.ofMillis(100)).subscribe(tick -> draining.releaseConnection());

        runtime.stop();

        assertEquals(List.of(draining.getId()), deprovisioned);
        assertEquals(0, draining.getActiveConnections());
        assertEquals(0, registry.size());
    }

    @Test
    void statisticsArePublishedToSharedStore() {
        Map<String, String> values = new HashMap<>();
        Map<String, Long> ttls = new HashMap<>();
        IRedisService redis = new IRedisService() {
            @Override
            public Mono<Long> slidingWindowCount(String key, long nowMs, long windowMs, long ttlSeconds,
                                                 String member) {
                return Mono.just(0L);
            }

            @Override
            public Mono<Void> setWithTtl(String key, String value, long ttlSeconds) {
                return Mono.fromRunnable(() -> {
                    values.put(key, value);
                    ttls.put(key, ttlSeconds);
                });
            }

            @Override
            public void close() {
            }
        };
        RouterRuntime runtime = new RouterRuntime(router, healthProbe, null, redis, Duration.ofSeconds(30));

        StepVerifier.create(runtime.publishStatistics()).verifyComplete();

        assertEquals(300L, ttls.get("router:stats"));
        assertTrue(values.get("router:stats").contains("\"totalInstances\":2"));
        assertTrue(values.get("router:stats").contains("\"strategy\":\"ROUND_ROBIN\""));
    }
}
