package io.meshroute.core.breaker;

/**
 * Circuit breaker states.
 * <ul>
 *   <li>CLOSED → OPEN: failure count reaches the threshold</li>
 *   <li>OPEN → HALF_OPEN: open timeout elapsed, one trial request granted</li>
 *   <li>HALF_OPEN → CLOSED: trial succeeded</li>
 *   <li>HALF_OPEN → OPEN: trial failed</li>
 * </ul>
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
