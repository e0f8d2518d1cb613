package io.meshroute.core.breaker;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link CircuitBreaker} per upstream target, created on first use.
 */
public class CircuitBreakerRegistry {
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final CircuitBreaker.TransitionListener listener;

    public CircuitBreakerRegistry(CircuitBreakerSettings settings, Clock clock, CircuitBreaker.TransitionListener listener) {
        this.settings = settings;
        this.clock = clock;
        this.listener = listener;
    }

    public CircuitBreakerRegistry(CircuitBreakerSettings settings, Clock clock) {
        this(settings, clock, null);
    }

    public CircuitBreaker forTarget(String targetId) {
        return breakers.computeIfAbsent(targetId, id -> new CircuitBreaker(id, settings, clock, listener));
    }

    public Optional<CircuitBreaker> find(String targetId) {
        return Optional.ofNullable(breakers.get(targetId));
    }

    public void remove(String targetId) {
        breakers.remove(targetId);
    }

    public long openCount() {
        return breakers.values().stream()
                .filter(b -> b.getState() != CircuitState.CLOSED)
                .count();
    }

    public Map<String, CircuitBreaker> getBreakers() {
        return Collections.unmodifiableMap(breakers);
    }

    public CircuitBreakerSettings getSettings() {
        return settings;
    }
}
