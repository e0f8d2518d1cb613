package io.meshroute.router.routing;

import io.meshroute.core.breaker.CircuitBreaker;
import io.meshroute.core.breaker.CircuitBreakerRegistry;
import io.meshroute.core.breaker.CircuitState;
import io.meshroute.core.metrics.MetricsNames;
import io.meshroute.core.metrics.MetricsTags;
import io.meshroute.core.model.RequestContext;
import io.meshroute.core.model.ServiceInstance;
import io.meshroute.core.ratelimit.RateLimitDecision;
import io.meshroute.core.ratelimit.RateLimitRule;
import io.meshroute.core.ratelimit.RateLimiter;
import io.meshroute.core.ratelimit.SubjectKeys;
import io.meshroute.router.registry.RegistryListener;
import io.meshroute.router.registry.ServiceRegistry;
import io.meshroute.router.strategy.LoadBalancingStrategy;
import io.meshroute.router.strategy.WeightedRoundRobinStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;

/**
 * Request-path facade: admission, instance selection and outcome bookkeeping.
 * <p>
 * <b>Selection:</b> candidates are the healthy, non-draining instances whose breaker
 * permits a call. The strategy picks one; its breaker is then acquired with
 * {@link CircuitBreaker#canExecute()}. Losing that acquisition to a concurrent
 * caller (a half-open trial taken in between) removes the instance from the
 * candidates and selection is retried.
 * </p>
 * <p>
 * <b>Thread-safety:</b> safe for any number of concurrent
 * {@link #routeRequest}/{@link #completeRequest} pairs. Counters are adders,
 * instance state is atomic, strategies and breakers synchronize internally.
 * </p>
 */
public class Router {
    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private final ServiceRegistry registry;
    private final LoadBalancingStrategy strategy;
    private final CircuitBreakerRegistry breakers;
    private final RateLimiter rateLimiter;

    private final LongAdder totalRequests = new LongAdder();
    private final LongAdder completedRequests = new LongAdder();
    private final LongAdder totalErrors = new LongAdder();
    private final DoubleAdder totalResponseTime = new DoubleAdder();

    private final Map<RouteResult.Outcome, Counter> outcomeCounters = new EnumMap<>(RouteResult.Outcome.class);
    private final Counter rateLimitAllowed;
    private final Counter rateLimitRejected;
    private final Timer successLatency;
    private final Timer failureLatency;
    private final List<RateLimitRule> rateLimitRules;

    public Router(ServiceRegistry registry,
                  LoadBalancingStrategy strategy,
                  CircuitBreakerRegistry breakers,
                  RateLimiter rateLimiter,
                  MeterRegistry meterRegistry) {
        this(registry, strategy, breakers, rateLimiter, List.of(), meterRegistry);
    }

    /**
     * @param rateLimitRules Rules applied by {@link #admit(RequestContext)}
     */
    public Router(ServiceRegistry registry,
                  LoadBalancingStrategy strategy,
                  CircuitBreakerRegistry breakers,
                  RateLimiter rateLimiter,
                  List<RateLimitRule> rateLimitRules,
                  MeterRegistry meterRegistry) {
        this.registry = registry;
        this.strategy = strategy;
        this.breakers = breakers;
        this.rateLimiter = rateLimiter;
        this.rateLimitRules = List.copyOf(rateLimitRules);

        if (strategy instanceof RegistryListener) {
            RegistryListener listener = (RegistryListener) strategy;
            registry.listAll().forEach(listener::onRegistered);
            registry.addListener(listener);
        }
        registry.addListener(new RegistryListener() {
            @Override
            public void onRegistered(ServiceInstance instance) {
            }

            @Override
            public void onDeregistered(ServiceInstance instance) {
                breakers.remove(instance.getId());
                if (strategy instanceof WeightedRoundRobinStrategy) {
                    ((WeightedRoundRobinStrategy) strategy).forget(instance.getId());
                }
            }
        });

        for (RouteResult.Outcome outcome : RouteResult.Outcome.values()) {
            outcomeCounters.put(outcome, Counter.builder(MetricsNames.ROUTER_REQUESTS_TOTAL)
                    .tag(MetricsTags.OUTCOME, outcome.name().toLowerCase())
                    .register(meterRegistry));
        }
        rateLimitAllowed = Counter.builder(MetricsNames.RATELIMIT_CHECKS_TOTAL)
                .tag(MetricsTags.RESULT, "allowed")
                .register(meterRegistry);
        rateLimitRejected = Counter.builder(MetricsNames.RATELIMIT_CHECKS_TOTAL)
                .tag(MetricsTags.RESULT, "rejected")
                .register(meterRegistry);
        successLatency = Timer.builder(MetricsNames.ROUTER_RESPONSE_LATENCY)
                .tag(MetricsTags.RESULT, "success")
                .register(meterRegistry);
        failureLatency = Timer.builder(MetricsNames.ROUTER_RESPONSE_LATENCY)
                .tag(MetricsTags.RESULT, "failure")
                .register(meterRegistry);

        Gauge.builder(MetricsNames.REGISTRY_INSTANCES, registry, ServiceRegistry::size)
                .register(meterRegistry);
        Gauge.builder(MetricsNames.REGISTRY_HEALTHY_INSTANCES, registry, ServiceRegistry::healthyCount)
                .register(meterRegistry);
    }

    /**
     * Selects an instance for a request without rate limiting.
     * A routed instance holds one active connection until {@link #completeRequest}.
     */
    public RouteResult routeRequest(RequestContext context) {
        RequestContext ctx = context != null ? context : RequestContext.EMPTY;

        List<ServiceInstance> healthy = registry.listHealthy().stream()
                .filter(instance -> !instance.isDraining())
                .collect(Collectors.toList());
        if (healthy.isEmpty()) {
            log.warn("No healthy instance available ({} registered)", registry.size());
            return count(RouteResult.noHealthyInstance());
        }

        List<ServiceInstance> candidates = new ArrayList<>(healthy.size());
        for (ServiceInstance instance : healthy) {
            if (breakers.forTarget(instance.getId()).isCallPermitted()) {
                candidates.add(instance);
            }
        }
        boolean breakerDenied = candidates.size() < healthy.size();

        while (!candidates.isEmpty()) {
            Optional<ServiceInstance> selected = strategy.select(candidates, ctx);
            if (selected.isEmpty()) {
                break;
            }
            ServiceInstance instance = selected.get();
            if (breakers.forTarget(instance.getId()).canExecute()) {
                instance.acquireConnection();
                totalRequests.increment();
                log.debug("Routed request (key={}) to {}", ctx.routingKey(), instance.getId());
                return count(RouteResult.routed(instance));
            }
            log.debug("Breaker of {} closed to this caller, reselecting", instance.getId());
            breakerDenied = true;
            candidates.remove(instance);
        }

        if (breakerDenied) {
            log.warn("All {} healthy instances rejected by open circuits", healthy.size());
            return count(RouteResult.circuitOpen());
        }
        return count(RouteResult.noHealthyInstance());
    }

    /**
     * Admits the request against the configured rate limit rules.
     *
     * @see #admit(RequestContext, List)
     */
    public Mono<RouteResult> admit(RequestContext context) {
        return admit(context, rateLimitRules);
    }

    /**
     * Checks the rules in order and routes the request if every rule allows it.
     * <p>
     * The first rejection short-circuits with {@link RouteResult.Outcome#RATE_LIMITED}
     * and the rejecting rule's headers. A routed result carries the headers of the
     * last rule checked.
     * </p>
     */
    public Mono<RouteResult> admit(RequestContext context, List<RateLimitRule> rules) {
        RequestContext ctx = context != null ? context : RequestContext.EMPTY;
        if (rules == null || rules.isEmpty()) {
            return Mono.fromSupplier(() -> routeRequest(ctx));
        }

        return Flux.fromIterable(rules)
                .concatMap(rule -> rateLimiter.check(SubjectKeys.forRule(rule, ctx), rule))
                .doOnNext(decision -> (decision.isAllowed() ? rateLimitAllowed : rateLimitRejected).increment())
                .takeUntil(decision -> !decision.isAllowed())
                .last()
                .map(decision -> {
                    if (!decision.isAllowed()) {
                        log.debug("Request rate limited (key={}), retry after {}s",
                                ctx.routingKey(), decision.getRetryAfterSeconds());
                        return count(RouteResult.rateLimited(decision.getHeaders()));
                    }
                    return routeRequest(ctx).withHeaders(decision.getHeaders());
                });
    }

    /**
     * Reports the outcome of a routed request.
     *
     * @param instance            Instance the request was routed to
     * @param responseTimeSeconds Observed response time
     * @param success             Whether the upstream call succeeded
     */
    public void completeRequest(ServiceInstance instance, double responseTimeSeconds, boolean success) {
        instance.recordResponseTime(responseTimeSeconds);
        instance.releaseConnection();

        completedRequests.increment();
        totalResponseTime.add(responseTimeSeconds);
        (success ? successLatency : failureLatency)
                .record(Duration.ofNanos((long) (responseTimeSeconds * 1_000_000_000L)));

        // a late completion for a removed instance must not resurrect its breaker
        Optional<CircuitBreaker> breaker = registry.get(instance.getId()).isPresent()
                ? Optional.of(breakers.forTarget(instance.getId()))
                : breakers.find(instance.getId());
        if (success) {
            breaker.ifPresent(CircuitBreaker::recordSuccess);
        } else {
            instance.addErrors(1);
            totalErrors.increment();
            breaker.ifPresent(CircuitBreaker::recordFailure);
            log.debug("Request to {} failed after {}s (errors={})",
                    instance.getId(), responseTimeSeconds, instance.getErrorCount());
        }
    }

    public RouterStatistics getStatistics() {
        List<ServiceInstance> all = registry.listAll();
        long completed = completedRequests.sum();
        long errors = totalErrors.sum();

        List<InstanceStatistics> details = all.stream()
                .map(instance -> InstanceStatistics.builder()
                        .id(instance.getId())
                        .url(instance.url())
                        .weight(instance.getWeight())
                        .healthy(instance.isHealthy())
                        .draining(instance.isDraining())
                        .healthScore(instance.getHealthScore())
                        .activeConnections(instance.getActiveConnections())
                        .errorCount(instance.getErrorCount())
                        .averageResponseTime(instance.getAverageResponseTime())
                        .circuitState(breakers.find(instance.getId())
                                .map(CircuitBreaker::getState)
                                .orElse(CircuitState.CLOSED))
                        .lastHealthCheck(instance.getLastHealthCheck())
                        .build())
                .collect(Collectors.toList());

        return RouterStatistics.builder()
                .strategy(strategy.type())
                .totalInstances(all.size())
                .healthyInstances(all.stream().filter(ServiceInstance::isHealthy).count())
                .openCircuits(breakers.openCount())
                .totalRequests(totalRequests.sum())
                .completedRequests(completed)
                .totalErrors(errors)
                .errorRate(completed > 0 ? (double) errors / completed : 0.0)
                .averageResponseTime(completed > 0 ? totalResponseTime.sum() / completed : 0.0)
                .activeConnections(all.stream().mapToInt(ServiceInstance::getActiveConnections).sum())
                .instances(details)
                .build();
    }

    public long getCompletedRequests() {
        return completedRequests.sum();
    }

    public long getTotalErrors() {
        return totalErrors.sum();
    }

    public LoadBalancingStrategy getStrategy() {
        return strategy;
    }

    public ServiceRegistry getRegistry() {
        return registry;
    }

    private RouteResult count(RouteResult result) {
        outcomeCounters.get(result.getOutcome()).increment();
        return result;
    }
}
