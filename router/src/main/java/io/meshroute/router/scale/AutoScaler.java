package io.meshroute.router.scale;

import io.meshroute.core.metrics.MetricsNames;
import io.meshroute.core.metrics.MetricsTags;
import io.meshroute.core.model.ProvisionRequest;
import io.meshroute.core.model.ScalingDirective;
import io.meshroute.core.model.ServiceInstance;
import io.meshroute.router.registry.ServiceRegistry;
import io.meshroute.router.routing.Router;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Threshold-based horizontal scaling of the instance fleet.
 * <p>
 * <b>Scale out</b> (one instance) when the healthy count is below the maximum, the
 * scale-up cooldown has passed, and any of average response time, error rate or
 * estimated CPU is above its threshold.
 * <br>
 * <b>Scale in</b> (one instance) when the healthy count is above the minimum, the
 * scale-down cooldown has passed, and response time and error rate are below half
 * their thresholds while estimated CPU is below the scale-down threshold. The
 * instance with the fewest connections is drained first.
 * </p>
 * <p>
 * Cooldowns start when an action is attempted, so a failing provisioner is not
 * retried every tick. Ticks run one after another; overlapping ticks are dropped.
 * </p>
 */
public class AutoScaler {
    private static final Logger log = LoggerFactory.getLogger(AutoScaler.class);

    private final Router router;
    private final ServiceRegistry registry;
    private final InstanceProvisioner provisioner;
    private final ScalingPolicy policy;
    private final InstanceTemplate template;
    private final Clock clock;

    private final AtomicInteger instanceSequence = new AtomicInteger();
    private final Map<String, ServiceInstance> pendingScaleIns = new ConcurrentHashMap<>();
    private volatile long lastScaleUpMs;
    private volatile long lastScaleDownMs;
    private long lastCompletedRequests;
    private long lastErrors;

    private final Counter scaleOutDecisions;
    private final Counter scaleInDecisions;
    private final Counter noScaleDecisions;
    private final Counter failures;

    private volatile Disposable subscription;

    public AutoScaler(Router router,
                      InstanceProvisioner provisioner,
                      ScalingPolicy policy,
                      InstanceTemplate template,
                      Clock clock,
                      MeterRegistry meterRegistry) {
        this.router = router;
        this.registry = router.getRegistry();
        this.provisioner = provisioner;
        this.policy = policy.validate();
        this.template = template;
        this.clock = clock;
        this.lastCompletedRequests = router.getCompletedRequests();
        this.lastErrors = router.getTotalErrors();

        scaleOutDecisions = Counter.builder(MetricsNames.SCALER_DECISIONS_TOTAL)
                .tag(MetricsTags.ACTION, "scale_out")
                .register(meterRegistry);
        scaleInDecisions = Counter.builder(MetricsNames.SCALER_DECISIONS_TOTAL)
                .tag(MetricsTags.ACTION, "scale_in")
                .register(meterRegistry);
        noScaleDecisions = Counter.builder(MetricsNames.SCALER_DECISIONS_TOTAL)
                .tag(MetricsTags.ACTION, "none")
                .register(meterRegistry);
        failures = Counter.builder(MetricsNames.SCALER_FAILURES_TOTAL)
                .register(meterRegistry);
    }

    public synchronized void start() {
        if (subscription != null && !subscription.isDisposed()) {
            return;
        }
        subscription = Flux.interval(policy.getEvaluationInterval())
                .onBackpressureDrop(tick -> log.warn("Scaling evaluation still running, skipping tick {}", tick))
                .concatMap(tick -> evaluateOnce()
                        .onErrorResume(err -> {
                            log.error("Scaling evaluation failed", err);
                            return Mono.empty();
                        }))
                .subscribe();
        log.info("Auto-scaler started (interval={}, instances {}..{})",
                policy.getEvaluationInterval(), policy.getMinInstances(), policy.getMaxInstances());
    }

    /**
     * Stops the evaluation loop. A scale-in interrupted by the stop is finished
     * here: its instance is drained (bounded by the drain timeout), removed and
     * deprovisioned before this method returns.
     */
    public synchronized void stop() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
            log.info("Auto-scaler stopped");
        }
        if (!pendingScaleIns.isEmpty()) {
            Duration bound = policy.getDrainTimeout().plus(policy.getDrainPollInterval()).multipliedBy(2);
            finishPendingScaleIns()
                    .timeout(bound)
                    .onErrorResume(err -> {
                        log.error("Could not finish pending scale-in within {}: {}", bound, err.toString());
                        return Mono.empty();
                    })
                    .block();
        }
    }

    Mono<Void> finishPendingScaleIns() {
        return Flux.fromIterable(List.copyOf(pendingScaleIns.values()))
                .doOnNext(instance -> log.info("Finishing interrupted scale-in of {}", instance.getId()))
                .flatMap(instance -> drain(instance).flatMap(drained -> retire(instance, drained)))
                .then();
    }

    public boolean isRunning() {
        Disposable current = subscription;
        return current != null && !current.isDisposed();
    }

    /**
     * Runs one evaluation and, if warranted, one scaling action.
     *
     * @return Mono of the directive describing what was done
     */
    public Mono<ScalingDirective> evaluateOnce() {
        return Mono.defer(() -> {
            FleetSnapshot snapshot = takeSnapshot();
            long now = clock.millis();

            log.debug("Fleet: healthy={}, avgRt={}s, errorRate={}, conn={}, cpu~{}%",
                    snapshot.getHealthyCount(), snapshot.getAverageResponseTime(), snapshot.getErrorRate(),
                    snapshot.getActiveConnections(), snapshot.getEstimatedCpu());

            if (shouldScaleUp(snapshot, now)) {
                return scaleUp(snapshot, now);
            }
            if (shouldScaleDown(snapshot, now)) {
                return scaleDown(snapshot, now);
            }
            noScaleDecisions.increment();
            return Mono.just(ScalingDirective.none("Within thresholds or cooling down", now));
        });
    }

    /**
     * Aggregates the current fleet; the error rate covers requests completed since the previous call.
     */
    synchronized FleetSnapshot takeSnapshot() {
        List<ServiceInstance> healthy = healthyInstances();

        double avgResponseTime = healthy.stream()
                .filter(instance -> !instance.getResponseTimes().isEmpty())
                .mapToDouble(ServiceInstance::getAverageResponseTime)
                .average()
                .orElse(0.0);
        int connections = healthy.stream().mapToInt(ServiceInstance::getActiveConnections).sum();

        long completed = router.getCompletedRequests();
        long errors = router.getTotalErrors();
        long completedDelta = completed - lastCompletedRequests;
        long errorDelta = errors - lastErrors;
        lastCompletedRequests = completed;
        lastErrors = errors;

        return FleetSnapshot.builder()
                .healthyCount(healthy.size())
                .averageResponseTime(avgResponseTime)
                .errorRate(completedDelta > 0 ? (double) errorDelta / completedDelta : 0.0)
                .activeConnections(connections)
                .estimatedCpu(FleetSnapshot.estimateCpu(avgResponseTime, connections))
                .build();
    }

    private boolean shouldScaleUp(FleetSnapshot snapshot, long now) {
        if (snapshot.getHealthyCount() >= policy.getMaxInstances()) {
            return false;
        }
        if (now - lastScaleUpMs <= policy.getScaleUpCooldown().toMillis()) {
            return false;
        }
        return snapshot.getAverageResponseTime() > policy.getResponseTimeThreshold()
                || snapshot.getErrorRate() > policy.getErrorRateThreshold()
                || snapshot.getEstimatedCpu() > policy.getCpuScaleUpThreshold();
    }

    private boolean shouldScaleDown(FleetSnapshot snapshot, long now) {
        if (snapshot.getHealthyCount() <= policy.getMinInstances()) {
            return false;
        }
        if (now - lastScaleDownMs <= policy.getScaleDownCooldown().toMillis()) {
            return false;
        }
        return snapshot.getAverageResponseTime() < policy.getResponseTimeThreshold() * 0.5
                && snapshot.getErrorRate() < policy.getErrorRateThreshold() * 0.5
                && snapshot.getEstimatedCpu() < policy.getCpuScaleDownThreshold();
    }

    private Mono<ScalingDirective> scaleUp(FleetSnapshot snapshot, long now) {
        lastScaleUpMs = now;
        String reason = String.format("Load above thresholds (rt=%.3fs, errors=%.1f%%, cpu=%.1f%%)",
                snapshot.getAverageResponseTime(), snapshot.getErrorRate() * 100, snapshot.getEstimatedCpu());

        int sequence = nextSequence();
        ProvisionRequest request = ProvisionRequest.builder()
                .instanceId("instance-" + sequence)
                .host(template.getHost())
                .port(template.getBasePort() + sequence)
                .weight(template.getWeight())
                .build();
        log.info("Scaling out: provisioning {} ({})", request.getInstanceId(), reason);

        return provisioner.provisionInstance(request)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("provisioner returned no instance")))
                .map(descriptor -> {
                    registry.register(ServiceInstance.from(descriptor));
                    scaleOutDecisions.increment();
                    return ScalingDirective.builder()
                            .action(ScalingDirective.Action.SCALE_OUT)
                            .targetReplicas(snapshot.getHealthyCount() + 1)
                            .reason(reason)
                            .timestampMs(now)
                            .build();
                })
                .onErrorMap(err -> !(err instanceof ScaleActionFailedException),
                        err -> new ScaleActionFailedException("Provisioning of " + request.getInstanceId() + " failed", err))
                .onErrorResume(ScaleActionFailedException.class, err -> {
                    failures.increment();
                    log.error("Scale-out failed: {}", err.getMessage(), err);
                    return Mono.just(ScalingDirective.none("Scale-out failed: " + err.getCause().getMessage(), now));
                });
    }

    private Mono<ScalingDirective> scaleDown(FleetSnapshot snapshot, long now) {
        Optional<ServiceInstance> candidate = healthyInstances().stream()
                .min(Comparator.comparingInt(ServiceInstance::getActiveConnections));
        if (candidate.isEmpty()) {
            noScaleDecisions.increment();
            return Mono.just(ScalingDirective.none("No instance to remove", now));
        }

        lastScaleDownMs = now;
        ServiceInstance instance = candidate.get();
        String reason = String.format("Load below thresholds (rt=%.3fs, errors=%.1f%%, cpu=%.1f%%)",
                snapshot.getAverageResponseTime(), snapshot.getErrorRate() * 100, snapshot.getEstimatedCpu());
        log.info("Scaling in: draining {} ({})", instance.getId(), reason);

        instance.setDraining(true);
        pendingScaleIns.put(instance.getId(), instance);
        return drain(instance)
                .flatMap(drained -> retire(instance, drained))
                .then(Mono.fromSupplier(() -> {
                    scaleInDecisions.increment();
                    return ScalingDirective.builder()
                            .action(ScalingDirective.Action.SCALE_IN)
                            .targetReplicas(snapshot.getHealthyCount() - 1)
                            .reason(reason)
                            .timestampMs(now)
                            .build();
                }));
    }

    /**
     * Removes a drained (or drain-timed-out) instance from routing and deprovisions it.
     */
    private Mono<Void> retire(ServiceInstance instance, boolean drained) {
        if (!drained) {
            log.warn("Drain of {} timed out after {} with {} active connections, removing anyway",
                    instance.getId(), policy.getDrainTimeout(), instance.getActiveConnections());
        }
        registry.deregister(instance.getId());
        return provisioner.deprovisionInstance(instance.getId())
                .onErrorMap(err -> new ScaleActionFailedException(
                        "Deprovisioning of " + instance.getId() + " failed", err))
                .onErrorResume(ScaleActionFailedException.class, err -> {
                    failures.increment();
                    log.error("Scale-in cleanup failed: {}", err.getMessage(), err);
                    return Mono.empty();
                })
                .doOnSuccess(ignored -> pendingScaleIns.remove(instance.getId(), instance));
    }

    /**
     * Polls the instance until it has no active connections.
     *
     * @return Mono of true when drained, false when the drain timeout elapsed first
     */
    Mono<Boolean> drain(ServiceInstance instance) {
        return Flux.interval(Duration.ZERO, policy.getDrainPollInterval())
                .map(tick -> instance.getActiveConnections())
                .filter(connections -> connections == 0)
                .next()
                .map(connections -> true)
                .timeout(policy.getDrainTimeout(), Mono.just(false));
    }

    private List<ServiceInstance> healthyInstances() {
        return registry.listHealthy().stream()
                .filter(instance -> !instance.isDraining())
                .collect(Collectors.toList());
    }

    private int nextSequence() {
        int sequence = Math.max(instanceSequence.get(), registry.size());
        do {
            sequence++;
        } while (registry.get("instance-" + sequence).isPresent());
        instanceSequence.set(sequence);
        return sequence;
    }

    public long getLastScaleUpMs() {
        return lastScaleUpMs;
    }

    public long getLastScaleDownMs() {
        return lastScaleDownMs;
    }
}
