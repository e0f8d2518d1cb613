package io.meshroute.router.config;

import io.meshroute.core.model.InstanceDescriptor;
import io.meshroute.core.ratelimit.RateLimitFailurePolicy;
import io.meshroute.core.ratelimit.RateLimitRule;
import io.meshroute.core.ratelimit.RateLimitScope;
import io.meshroute.router.strategy.StrategyType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RouterConfigTest {

    @Test
    void defaultsWithoutEnvironment() {
        RouterConfig config = RouterConfig.fromEnv(key -> null);

        assertEquals(StrategyType.RESPONSE_TIME, config.getStrategy());
        assertEquals(150, config.getHashReplicas());
        assertEquals(5, config.getBreakerSettings().getFailureThreshold());
        assertEquals(Duration.ofSeconds(60), config.getBreakerSettings().getOpenTimeout());
        assertEquals(RateLimitFailurePolicy.FAIL_OPEN, config.getRateLimitFailurePolicy());
        assertEquals(Duration.ofSeconds(30), config.getProbeInterval());
        assertEquals(Duration.ofSeconds(3), config.getProbeTimeout());
        assertEquals("/health", config.getHealthPath());
        assertEquals(70.0, config.getScalingPolicy().getCpuScaleUpThreshold());
        assertEquals(Duration.ofSeconds(180), config.getScalingPolicy().getScaleUpCooldown());
        assertEquals(Duration.ofSeconds(300), config.getScalingPolicy().getScaleDownCooldown());
        assertFalse(config.isRedisEnabled());
        assertTrue(config.isAutoScalingEnabled());
        assertTrue(config.getRateLimitRules().isEmpty());
        assertTrue(config.getInitialInstances().isEmpty());
    }

    @Test
    void readsOverridesFromEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("LOAD_BALANCING_STRATEGY", "consistent-hash");
        env.put("BREAKER_FAILURE_THRESHOLD", "10");
        env.put("RATE_LIMIT_FAILURE_POLICY", "fail_closed");
        env.put("RATE_LIMIT_RULES", "100/60:ip, 5000/3600:api_key");
        env.put("INSTANCES", "a@10.0.0.1:8080,b@10.0.0.2:8081:3");
        env.put("SCALE_MAX_INSTANCES", "4");

        RouterConfig config = RouterConfig.fromEnv(env::get);

        assertEquals(StrategyType.CONSISTENT_HASH, config.getStrategy());
        assertEquals(10, config.getBreakerSettings().getFailureThreshold());
        assertEquals(RateLimitFailurePolicy.FAIL_CLOSED, config.getRateLimitFailurePolicy());
        assertEquals(4, config.getScalingPolicy().getMaxInstances());

        List<RateLimitRule> rules = config.getRateLimitRules();
        assertEquals(2, rules.size());
        assertEquals(RateLimitScope.IP, rules.get(0).getScope());
        assertEquals(100, rules.get(0).getRequestsAllowed());
        assertEquals(3600, rules.get(1).getWindowSeconds());
        assertEquals(RateLimitScope.API_KEY, rules.get(1).getScope());

        List<InstanceDescriptor> instances = config.getInitialInstances();
        assertEquals(2, instances.size());
        assertEquals("a", instances.get(0).getId());
        assertEquals(1, instances.get(0).getWeight());
        assertEquals("10.0.0.2", instances.get(1).getHost());
        assertEquals(8081, instances.get(1).getPort());
        assertEquals(3, instances.get(1).getWeight());
    }

    @Test
    void ruleWithoutScopeIsGlobal() {
        assertEquals(RateLimitScope.GLOBAL, RouterConfig.parseRules("10/1").get(0).getScope());
    }

    @Test
    void malformedEntriesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> RouterConfig.parseInstances("10.0.0.1:8080"));
        assertThrows(IllegalArgumentException.class, () -> RouterConfig.parseInstances("a@10.0.0.1"));
        assertThrows(IllegalArgumentException.class, () -> RouterConfig.parseRules("100:ip"));
        assertThrows(IllegalArgumentException.class, () -> RouterConfig.parseRules("0/60"));
    }
}
