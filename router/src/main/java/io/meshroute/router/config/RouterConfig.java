package io.meshroute.router.config;

import io.meshroute.core.breaker.CircuitBreakerSettings;
import io.meshroute.core.hash.ConsistentHashRing;
import io.meshroute.core.model.InstanceDescriptor;
import io.meshroute.core.ratelimit.RateLimitFailurePolicy;
import io.meshroute.core.ratelimit.RateLimitRule;
import io.meshroute.core.ratelimit.RateLimitScope;
import io.meshroute.router.scale.InstanceTemplate;
import io.meshroute.router.scale.ScalingPolicy;
import io.meshroute.router.strategy.StrategyType;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Configuration for the router, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class RouterConfig {

    String nodeId;

    // Shared store
    boolean redisEnabled;
    String redisUrl;

    // Routing
    StrategyType strategy;
    int hashReplicas;
    CircuitBreakerSettings breakerSettings;

    // Rate limiting
    List<RateLimitRule> rateLimitRules;
    RateLimitFailurePolicy rateLimitFailurePolicy;

    // Health probing
    Duration probeInterval;
    Duration probeTimeout;
    String healthPath;

    // Auto-scaling
    boolean autoScalingEnabled;
    ScalingPolicy scalingPolicy;
    InstanceTemplate instanceTemplate;

    Duration statsPublishInterval;
    List<InstanceDescriptor> initialInstances;

    public static RouterConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    /**
     * @param env Variable lookup returning null for unset variables
     */
    public static RouterConfig fromEnv(Function<String, String> env) {
        ScalingPolicy scalingPolicy = ScalingPolicy.builder()
            .minInstances(Integer.parseInt(getEnv(env, "SCALE_MIN_INSTANCES", "1")))
            .maxInstances(Integer.parseInt(getEnv(env, "SCALE_MAX_INSTANCES", "10")))
            .cpuScaleUpThreshold(Double.parseDouble(getEnv(env, "SCALE_CPU_UP_THRESHOLD", "70")))
            .cpuScaleDownThreshold(Double.parseDouble(getEnv(env, "SCALE_CPU_DOWN_THRESHOLD", "30")))
            .responseTimeThreshold(Double.parseDouble(getEnv(env, "SCALE_RESPONSE_TIME_THRESHOLD_SEC", "2.0")))
            .errorRateThreshold(Double.parseDouble(getEnv(env, "SCALE_ERROR_RATE_THRESHOLD", "0.05")))
            .scaleUpCooldown(Duration.ofSeconds(Long.parseLong(getEnv(env, "SCALE_UP_COOLDOWN_SEC", "180"))))
            .scaleDownCooldown(Duration.ofSeconds(Long.parseLong(getEnv(env, "SCALE_DOWN_COOLDOWN_SEC", "300"))))
            .drainTimeout(Duration.ofSeconds(Long.parseLong(getEnv(env, "DRAIN_TIMEOUT_SEC", "30"))))
            .drainPollInterval(Duration.ofMillis(Long.parseLong(getEnv(env, "DRAIN_POLL_MS", "1000"))))
            .evaluationInterval(Duration.ofSeconds(Long.parseLong(getEnv(env, "SCALE_INTERVAL_SEC", "60"))))
            .build();

        return RouterConfig.builder()
            .nodeId(getEnv(env, "NODE_ID", "router-1"))
            .redisEnabled(Boolean.parseBoolean(getEnv(env, "REDIS_ENABLED", "false")))
            .redisUrl(getEnv(env, "REDIS_URL", "redis://localhost:6379"))
            .strategy(StrategyType.parse(getEnv(env, "LOAD_BALANCING_STRATEGY", "response_time")))
            .hashReplicas(Integer.parseInt(getEnv(env, "HASH_REPLICAS", String.valueOf(ConsistentHashRing.DEFAULT_REPLICAS))))
            .breakerSettings(CircuitBreakerSettings.builder()
                .failureThreshold(Integer.parseInt(getEnv(env, "BREAKER_FAILURE_THRESHOLD", "5")))
                .openTimeout(Duration.ofSeconds(Long.parseLong(getEnv(env, "BREAKER_OPEN_TIMEOUT_SEC", "60"))))
                .build())
            .rateLimitRules(parseRules(getEnv(env, "RATE_LIMIT_RULES", "")))
            .rateLimitFailurePolicy(RateLimitFailurePolicy.valueOf(
                getEnv(env, "RATE_LIMIT_FAILURE_POLICY", "FAIL_OPEN").trim().toUpperCase()))
            .probeInterval(Duration.ofSeconds(Long.parseLong(getEnv(env, "PROBE_INTERVAL_SEC", "30"))))
            .probeTimeout(Duration.ofMillis(Long.parseLong(getEnv(env, "PROBE_TIMEOUT_MS", "3000"))))
            .healthPath(getEnv(env, "HEALTH_PATH", "/health"))
            .autoScalingEnabled(Boolean.parseBoolean(getEnv(env, "AUTO_SCALING_ENABLED", "true")))
            .scalingPolicy(scalingPolicy)
            .instanceTemplate(InstanceTemplate.builder()
                .host(getEnv(env, "PROVISION_HOST", "localhost"))
                .basePort(Integer.parseInt(getEnv(env, "PROVISION_BASE_PORT", "8080")))
                .weight(Integer.parseInt(getEnv(env, "PROVISION_WEIGHT", "1")))
                .build())
            .statsPublishInterval(Duration.ofSeconds(Long.parseLong(getEnv(env, "STATS_PUBLISH_INTERVAL_SEC", "30"))))
            .initialInstances(parseInstances(getEnv(env, "INSTANCES", "")))
            .build();
    }

    /**
     * Parses {@code id@host:port[:weight]} entries separated by commas.
     */
    static List<InstanceDescriptor> parseInstances(String value) {
        if (value == null || value.isBlank()) {
            return Collections.emptyList();
        }
        List<InstanceDescriptor> instances = new ArrayList<>();
        for (String entry : value.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int at = trimmed.indexOf('@');
            if (at <= 0) {
                throw new IllegalArgumentException("Instance entry must look like id@host:port[:weight]: " + trimmed);
            }
            String[] address = trimmed.substring(at + 1).split(":");
            if (address.length < 2 || address.length > 3) {
                throw new IllegalArgumentException("Instance entry must look like id@host:port[:weight]: " + trimmed);
            }
            instances.add(InstanceDescriptor.builder()
                .id(trimmed.substring(0, at))
                .host(address[0])
                .port(Integer.parseInt(address[1]))
                .weight(address.length == 3 ? Integer.parseInt(address[2]) : 1)
                .build());
        }
        return instances;
    }

    /**
     * Parses {@code requests/windowSeconds[:scope]} entries separated by commas,
     * e.g. {@code 100/60:ip,5000/3600:user}.
     */
    static List<RateLimitRule> parseRules(String value) {
        if (value == null || value.isBlank()) {
            return Collections.emptyList();
        }
        List<RateLimitRule> rules = new ArrayList<>();
        for (String entry : value.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] parts = trimmed.split(":");
            String[] limit = parts[0].split("/");
            if (limit.length != 2 || parts.length > 2) {
                throw new IllegalArgumentException("Rate limit rule must look like requests/windowSeconds[:scope]: " + trimmed);
            }
            RateLimitScope scope = parts.length == 2
                ? RateLimitScope.valueOf(parts[1].trim().toUpperCase())
                : RateLimitScope.GLOBAL;
            rules.add(new RateLimitRule(Integer.parseInt(limit[0].trim()), Integer.parseInt(limit[1].trim()), scope));
        }
        return rules;
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value != null ? value : defaultValue;
    }
}
