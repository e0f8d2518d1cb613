package io.meshroute.router.health;

import com.google.common.collect.EvictingQueue;
import io.meshroute.core.metrics.MetricsNames;
import io.meshroute.core.metrics.MetricsTags;
import io.meshroute.core.model.ServiceInstance;
import io.meshroute.core.redis.Keys;
import io.meshroute.core.util.JsonUtils;
import io.meshroute.router.redis.IRedisService;
import io.meshroute.router.registry.ServiceRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Periodic liveness probing of every registered instance.
 * <p>
 * Each tick probes all instances concurrently, each bounded by its own timeout, and
 * writes the outcome into the instance:
 * <ul>
 *   <li>2xx: score = latency tier x error decay, error count decremented, latency
 *       appended to the response time window</li>
 *   <li>other status: error count + 1, score 0.1</li>
 *   <li>exception or timeout: error count + 2, score 0.0</li>
 * </ul>
 * Probe failures never escape the loop. Ticks that arrive while a round is still
 * running are dropped.
 * </p>
 */
public class HealthProbe {
    private static final Logger log = LoggerFactory.getLogger(HealthProbe.class);

    static final int HISTORY_SIZE = 1000;
    static final Duration SUMMARY_WINDOW = Duration.ofHours(1);

    private final ServiceRegistry registry;
    private final ProbeClient probeClient;
    private final Duration interval;
    private final Duration timeout;
    private final Clock clock;
    private final IRedisService redisService;
    private final MeterRegistry meterRegistry;
    private final Timer probeLatency;

    private final EvictingQueue<HealthCheckResult> history = EvictingQueue.create(HISTORY_SIZE);
    private final Map<String, HealthCheckResult> latest = new ConcurrentHashMap<>();
    private final List<HealthCheckListener> listeners = new CopyOnWriteArrayList<>();

    private volatile Disposable subscription;

    /**
     * @param redisService Shared store for result publication, null to keep results local
     */
    public HealthProbe(ServiceRegistry registry,
                       ProbeClient probeClient,
                       Duration interval,
                       Duration timeout,
                       Clock clock,
                       MeterRegistry meterRegistry,
                       IRedisService redisService) {
        this.registry = registry;
        this.probeClient = probeClient;
        this.interval = interval;
        this.timeout = timeout;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.redisService = redisService;
        this.probeLatency = Timer.builder(MetricsNames.HEALTH_PROBE_LATENCY).register(meterRegistry);
    }

    public HealthProbe(ServiceRegistry registry, ProbeClient probeClient, Duration interval, Duration timeout,
                       Clock clock, MeterRegistry meterRegistry) {
        this(registry, probeClient, interval, timeout, clock, meterRegistry, null);
    }

    public void addListener(HealthCheckListener listener) {
        listeners.add(listener);
    }

    public synchronized void start() {
        if (subscription != null && !subscription.isDisposed()) {
            return;
        }
        subscription = Flux.interval(interval)
                .onBackpressureDrop(tick -> log.warn("Health probe round still running, skipping tick {}", tick))
                .concatMap(tick -> probeAll()
                        .onErrorResume(err -> {
                            log.error("Health probe round failed", err);
                            return Mono.empty();
                        }))
                .subscribe();
        log.info("Health probe started (interval={}, timeout={})", interval, timeout);
    }

    public synchronized void stop() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
            log.info("Health probe stopped");
        }
    }

    public boolean isRunning() {
        Disposable current = subscription;
        return current != null && !current.isDisposed();
    }

    /**
     * Probes every registered instance concurrently.
     *
     * @return Mono of all results of this round
     */
    public Mono<List<HealthCheckResult>> probeAll() {
        List<ServiceInstance> instances = registry.listAll();
        return Flux.fromIterable(instances)
                .flatMap(this::probeInstance)
                .collectList()
                .doOnNext(results -> log.debug("Probed {} instances, {} healthy", results.size(),
                        results.stream().filter(r -> r.getStatus() == HealthStatus.HEALTHY).count()));
    }

    /**
     * Probes one instance and applies the outcome to it. Never errors.
     */
    public Mono<HealthCheckResult> probeInstance(ServiceInstance instance) {
        return Mono.defer(() -> {
                    long startMs = clock.millis();
                    return Mono.defer(() -> probeClient.probe(instance, timeout))
                            .timeout(timeout)
                            .map(statusCode -> onResponse(instance, statusCode, clock.millis() - startMs))
                            .switchIfEmpty(Mono.fromSupplier(() -> onFailure(instance,
                                    new IllegalStateException("empty probe response"), clock.millis() - startMs)))
                            .onErrorResume(err -> Mono.just(onFailure(instance, err, clock.millis() - startMs)));
                })
                .flatMap(this::publish)
                .doOnNext(this::record);
    }

    private HealthCheckResult onResponse(ServiceInstance instance, int statusCode, long latencyMs) {
        Instant now = clock.instant();
        instance.setLastHealthCheck(now);

        if (statusCode < 200 || statusCode >= 300) {
            instance.addErrors(1);
            instance.setHealthScore(HealthScorer.NON_SUCCESS_SCORE);
            log.warn("Instance {} answered health probe with status {}", instance.getId(), statusCode);
            return result(instance, HealthStatus.UNHEALTHY, "HTTP " + statusCode, now, latencyMs, statusCode, null);
        }

        double score = HealthScorer.score(latencyMs, instance.getErrorCount());
        instance.setHealthScore(score);
        instance.decayErrors();
        instance.recordResponseTime(latencyMs / 1000.0);

        HealthStatus status = HealthScorer.statusOf(score);
        return result(instance, status, String.format("score %.2f", score), now, latencyMs, statusCode, null);
    }

    private HealthCheckResult onFailure(ServiceInstance instance, Throwable err, long latencyMs) {
        Instant now = clock.instant();
        instance.setLastHealthCheck(now);
        instance.addErrors(2);
        instance.setHealthScore(HealthScorer.FAILURE_SCORE);

        String error = err instanceof TimeoutException
                ? "probe timed out after " + timeout.toMillis() + "ms"
                : err.getClass().getSimpleName() + ": " + err.getMessage();
        log.warn("Health probe of {} failed: {}", instance.getId(), error);
        return result(instance, HealthStatus.UNHEALTHY, "probe failed", now, latencyMs, null, error);
    }

    private HealthCheckResult result(ServiceInstance instance, HealthStatus status, String message, Instant now,
                                     long latencyMs, Integer statusCode, String error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("url", instance.url());
        details.put("healthScore", instance.getHealthScore());
        details.put("errorCount", instance.getErrorCount());
        if (statusCode != null) {
            details.put("statusCode", statusCode);
        }
        return HealthCheckResult.builder()
                .component(instance.getId())
                .status(status)
                .message(message)
                .timestamp(now)
                .responseTimeMs(latencyMs)
                .details(details)
                .error(error)
                .build();
    }

    private Mono<HealthCheckResult> publish(HealthCheckResult result) {
        if (redisService == null) {
            return Mono.just(result);
        }
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(result))
                .flatMap(json -> redisService.setWithTtl(
                        Keys.instanceHealth(result.getComponent()), json, interval.getSeconds() + 1))
                .doOnError(err -> log.warn("Failed to publish health of {}: {}", result.getComponent(), err.getMessage()))
                .onErrorResume(err -> Mono.empty())
                .thenReturn(result);
    }

    private void record(HealthCheckResult result) {
        synchronized (history) {
            history.add(result);
        }
        latest.put(result.getComponent(), result);
        probeLatency.record(Duration.ofMillis((long) result.getResponseTimeMs()));
        meterRegistry.counter(MetricsNames.HEALTH_PROBES_TOTAL,
                MetricsTags.STATUS, result.getStatus().name().toLowerCase()).increment();

        for (HealthCheckListener listener : listeners) {
            try {
                listener.onResult(result);
            } catch (Exception e) {
                log.error("Health check listener failed for {}", result.getComponent(), e);
            }
        }
    }

    /**
     * Overall health: the worst latest status among probed instances that are still
     * registered, UNKNOWN before the first result.
     */
    public HealthCheckResult currentHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.UNKNOWN;
        for (HealthCheckResult result : latest.values()) {
            if (registry.get(result.getComponent()).isEmpty()) {
                continue;
            }
            overall = overall.worst(result.getStatus());
            details.put(result.getComponent(), result.getStatus());
        }
        return HealthCheckResult.builder()
                .component("router")
                .status(overall)
                .message(details.size() + " instances reporting")
                .timestamp(clock.instant())
                .details(details)
                .build();
    }

    /**
     * Summary of one instance's probe results over the last hour.
     */
    public HealthSummary summary(String instanceId) {
        Instant since = clock.instant().minus(SUMMARY_WINDOW);
        List<HealthCheckResult> recent = history().stream()
                .filter(r -> r.getComponent().equals(instanceId))
                .filter(r -> !r.getTimestamp().isBefore(since))
                .collect(Collectors.toList());

        int healthy = (int) recent.stream().filter(r -> r.getStatus() == HealthStatus.HEALTHY).count();
        return HealthSummary.builder()
                .component(instanceId)
                .totalChecks(recent.size())
                .healthyChecks(healthy)
                .availability(recent.isEmpty() ? 0.0 : (double) healthy / recent.size())
                .averageResponseTimeMs(recent.stream().mapToDouble(HealthCheckResult::getResponseTimeMs).average().orElse(0.0))
                .lastStatus(recent.isEmpty() ? HealthStatus.UNKNOWN : recent.get(recent.size() - 1).getStatus())
                .build();
    }

    /**
     * @return results oldest first, at most {@value #HISTORY_SIZE}
     */
    public List<HealthCheckResult> history() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }
}
