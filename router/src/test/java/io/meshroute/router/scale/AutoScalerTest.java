package io.meshroute.router.scale;

import io.meshroute.core.breaker.CircuitBreakerRegistry;
import io.meshroute.core.breaker.CircuitBreakerSettings;
import io.meshroute.core.metrics.MetricsNames;
import io.meshroute.core.model.InstanceDescriptor;
import io.meshroute.core.model.ProvisionRequest;
import io.meshroute.core.model.RequestContext;
import io.meshroute.core.model.ScalingDirective;
import io.meshroute.core.model.ServiceInstance;
import io.meshroute.core.ratelimit.LocalTokenBucketRateLimiter;
import io.meshroute.router.registry.ServiceRegistry;
import io.meshroute.router.routing.Router;
import io.meshroute.router.strategy.RoundRobinStrategy;
import io.meshroute.router.support.ManualClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * AutoScaler tests with a hand-written provisioner (no Mockito).
 */
class AutoScalerTest {

    private ManualClock clock;
    private ServiceRegistry registry;
    private Router router;
    private TestProvisioner provisioner;
    private SimpleMeterRegistry meterRegistry;
    private ScalingPolicy policy;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        registry = new ServiceRegistry();
        meterRegistry = new SimpleMeterRegistry();
        router = new Router(registry, new RoundRobinStrategy(),
                new CircuitBreakerRegistry(CircuitBreakerSettings.DEFAULTS, clock),
                new LocalTokenBucketRateLimiter(clock), meterRegistry);
        provisioner = new TestProvisioner();
        policy = ScalingPolicy.builder()
                .minInstances(1)
                .maxInstances(3)
                .drainTimeout(Duration.ofMillis(300))
                .drainPollInterval(Duration.ofMillis(20))
                .build();
    }

    private AutoScaler newScaler(ScalingPolicy scalingPolicy) {
        return new AutoScaler(router, provisioner, scalingPolicy,
                InstanceTemplate.builder().host("10.0.0.9").basePort(9000).weight(2).build(),
                clock, meterRegistry);
    }

    @Test
    void slowFleetScalesOut() {
        register("a").recordResponseTime(3.0);
        register("b").recordResponseTime(3.0);
        AutoScaler scaler = newScaler(policy);

        StepVerifier.create(scaler.evaluateOnce())
                .assertNext(directive -> {
                    assertEquals(ScalingDirective.Action.SCALE_OUT, directive.getAction());
                    assertEquals(3, directive.getTargetReplicas());
                })
                .verifyComplete();

        assertEquals(3, registry.size());
        ProvisionRequest request = provisioner.provisioned.get(0);
        assertEquals("instance-3", request.getInstanceId());
        assertEquals("10.0.0.9", request.getHost());
        assertEquals(9003, request.getPort());
        assertEquals(2, registry.get("instance-3").orElseThrow().getWeight());
        assertEquals(clock.millis(), scaler.getLastScaleUpMs());
    }

    @Test
    void scaleOutRespectsCooldown() {
        register("a").recordResponseTime(3.0);
        AutoScaler scaler = newScaler(policy.toBuilder().maxInstances(5).build());

        assertEquals(ScalingDirective.Action.SCALE_OUT, scaler.evaluateOnce().block().getAction());
        clock.advance(Duration.ofSeconds(180));
        assertEquals(ScalingDirective.Action.NONE, scaler.evaluateOnce().block().getAction());
        clock.advance(Duration.ofSeconds(1));
        assertEquals(ScalingDirective.Action.SCALE_OUT, scaler.evaluateOnce().block().getAction());

        assertEquals(2, provisioner.provisioned.size());
    }

    @Test
    void neverScalesOutAtMaxInstances() {
        register("a").recordResponseTime(5.0);
        register("b").recordResponseTime(5.0);
        AutoScaler scaler = newScaler(policy.toBuilder().maxInstances(2).build());

        assertEquals(ScalingDirective.Action.NONE, scaler.evaluateOnce().block().getAction());
        assertTrue(provisioner.provisioned.isEmpty());
    }

    @Test
    void errorRateSinceLastTickTriggersScaleOut() {
        register("a");
        AutoScaler scaler = newScaler(policy);
        for (int i = 0; i < 10; i++) {
            ServiceInstance instance = router.routeRequest(RequestContext.EMPTY).getInstance();
            router.completeRequest(instance, 0.01, i != 0);
        }

        FleetSnapshot snapshot = scaler.takeSnapshot();
        assertEquals(0.1, snapshot.getErrorRate(), 1e-9);
        // the next window starts empty
        assertEquals(0.0, scaler.takeSnapshot().getErrorRate(), 1e-9);

        for (int i = 0; i < 10; i++) {
            ServiceInstance instance = router.routeRequest(RequestContext.EMPTY).getInstance();
            router.completeRequest(instance, 0.01, i != 0);
        }
        assertEquals(ScalingDirective.Action.SCALE_OUT, scaler.evaluateOnce().block().getAction());
    }

    @Test
    void provisioningFailureStillStartsCooldown() {
        register("a").recordResponseTime(3.0);
        provisioner.failWith = new IllegalStateException("quota exceeded");
        AutoScaler scaler = newScaler(policy);

        StepVerifier.create(scaler.evaluateOnce())
                .assertNext(directive -> {
                    assertEquals(ScalingDirective.Action.NONE, directive.getAction());
                    assertTrue(directive.getReason().contains("quota exceeded"));
                })
                .verifyComplete();

        assertEquals(clock.millis(), scaler.getLastScaleUpMs());
        assertEquals(1, registry.size());
        assertEquals(1.0, meterRegistry.counter(MetricsNames.SCALER_FAILURES_TOTAL).count());

        scaler.evaluateOnce().block();
        assertEquals(1, provisioner.attempts);
    }

    @Test
    void idleFleetScalesInRemovingLeastLoadedInstance() {
        ServiceInstance a = register("a");
        ServiceInstance b = register("b");
        ServiceInstance c = register("c");
        for (ServiceInstance instance : List.of(a, b, c)) {
            instance.recordResponseTime(0.1);
        }
        a.acquireConnection();
        b.acquireConnection();
        AutoScaler scaler = newScaler(policy);

        StepVerifier.create(scaler.evaluateOnce())
                .assertNext(directive -> {
                    assertEquals(ScalingDirective.Action.SCALE_IN, directive.getAction());
                    assertEquals(2, directive.getTargetReplicas());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertTrue(registry.get("c").isEmpty());
        assertTrue(c.isDraining());
        assertEquals(List.of("c"), provisioner.deprovisioned);
        assertEquals(clock.millis(), scaler.getLastScaleDownMs());
    }

    @Test
    void drainTimeoutForcesRemoval() {
        ServiceInstance a = register("a");
        ServiceInstance b = register("b");
        a.acquireConnection();
        b.acquireConnection();
        AutoScaler scaler = newScaler(policy);

        StepVerifier.create(scaler.evaluateOnce())
                .assertNext(directive -> assertEquals(ScalingDirective.Action.SCALE_IN, directive.getAction()))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertEquals(1, registry.size());
        assertEquals(1, provisioner.deprovisioned.size());
    }

    @Test
    void drainCompletesOnceConnectionsReachZero() {
        ServiceInstance a = register("a");
        a.acquireConnection();
        AutoScaler scaler = newScaler(policy.toBuilder().drainTimeout(Duration.ofSeconds(5)).build());

        Mono.delay(Duration.ofMillis(100)).subscribe(tick -> a.releaseConnection());

        StepVerifier.create(scaler.drain(a))
                .expectNext(true)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void deprovisionFailureStillRemovesInstance() {
        register("a");
        register("b");
        provisioner.deprovisionFailure = new IllegalStateException("api unavailable");
        AutoScaler scaler = newScaler(policy);

        StepVerifier.create(scaler.evaluateOnce())
                .assertNext(directive -> assertEquals(ScalingDirective.Action.SCALE_IN, directive.getAction()))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertEquals(1, registry.size());
        assertEquals(1.0, meterRegistry.counter(MetricsNames.SCALER_FAILURES_TOTAL).count());
    }

    @Test
    void scaleInRespectsMinimumAndCooldown() {
        register("a");
        register("b");
        register("c");
        AutoScaler scaler = newScaler(policy.toBuilder().minInstances(2).build());

        assertEquals(ScalingDirective.Action.SCALE_IN, scaler.evaluateOnce().block(Duration.ofSeconds(5)).getAction());
        clock.advance(Duration.ofSeconds(301));
        // two healthy instances left, at the minimum
        assertEquals(ScalingDirective.Action.NONE, scaler.evaluateOnce().block().getAction());
        assertEquals(1, provisioner.deprovisioned.size());
    }

    @Test
    void estimatedCpuFormula() {
        assertEquals(20.0, FleetSnapshot.estimateCpu(0.0, 0), 1e-9);
        assertEquals(55.0, FleetSnapshot.estimateCpu(1.0, 5), 1e-9);
        assertEquals(100.0, FleetSnapshot.estimateCpu(10.0, 100), 1e-9);
    }

    @Test
    void invalidPolicyIsRejected() {
        ScalingPolicy inverted = ScalingPolicy.builder().minInstances(5).maxInstances(2).build();

        assertThrows(IllegalArgumentException.class, () -> newScaler(inverted));
    }

    private ServiceInstance register(String id) {
        ServiceInstance instance = new ServiceInstance(id, "localhost", 8000 + registry.size());
        registry.register(instance);
        return instance;
    }

    static class TestProvisioner implements InstanceProvisioner {
        final List<ProvisionRequest> provisioned = new ArrayList<>();
        final List<String> deprovisioned = new ArrayList<>();
        RuntimeException failWith;
        RuntimeException deprovisionFailure;
        int attempts;

        @Override
        public Mono<InstanceDescriptor> provisionInstance(ProvisionRequest request) {
            attempts++;
            if (failWith != null) {
                return Mono.error(failWith);
            }
            provisioned.add(request);
            return Mono.just(InstanceDescriptor.builder()
                    .id(request.getInstanceId())
                    .host(request.getHost())
                    .port(request.getPort())
                    .weight(request.getWeight())
                    .build());
        }

        @Override
        public Mono<Void> deprovisionInstance(String instanceId) {
            deprovisioned.add(instanceId);
            if (deprovisionFailure != null) {
                return Mono.error(deprovisionFailure);
            }
            return Mono.empty();
        }
    }
}
