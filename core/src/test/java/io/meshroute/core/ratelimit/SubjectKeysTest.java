package io.meshroute.core.ratelimit;

import io.meshroute.core.model.RequestContext;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubjectKeysTest {

    private final RequestContext full = RequestContext.builder()
            .userId("u1").apiKey("k1").ip("10.1.2.3").build();

    @Test
    void testKeyPerScope() {
        assertEquals("global", SubjectKeys.forRule(rule(RateLimitScope.GLOBAL), full));
        assertEquals("user:u1", SubjectKeys.forRule(rule(RateLimitScope.USER), full));
        assertEquals("api_key:k1", SubjectKeys.forRule(rule(RateLimitScope.API_KEY), full));
        assertEquals("ip:10.1.2.3", SubjectKeys.forRule(rule(RateLimitScope.IP), full));
    }

    @Test
    void testMissingIdentityFallsBackToAddress() {
        RequestContext anonymous = RequestContext.builder().ip("192.168.0.9").build();

        assertEquals("ip:192.168.0.9", SubjectKeys.forRule(rule(RateLimitScope.USER), anonymous));
        assertEquals("ip:192.168.0.9", SubjectKeys.forRule(rule(RateLimitScope.API_KEY), anonymous));
        assertEquals("ip:unknown", SubjectKeys.forRule(rule(RateLimitScope.IP), RequestContext.EMPTY));
    }

    @Test
    void testRuleDefaultsAndValidation() {
        RateLimitRule rule = RateLimitRule.of(10, 60);
        assertEquals(20, rule.getBurstLimit());
        assertEquals(RateLimitScope.GLOBAL, rule.getScope());

        assertThrows(IllegalArgumentException.class, () -> RateLimitRule.of(0, 60));
        assertThrows(IllegalArgumentException.class, () -> RateLimitRule.of(10, 0));
    }

    private static RateLimitRule rule(RateLimitScope scope) {
        return new RateLimitRule(10, 60, scope);
    }
}
