package io.meshroute.core.breaker;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Failure-isolation state machine for a single upstream target.
 * <p>
 * <b>Transitions:</b>
 * <ul>
 *   <li>CLOSED: failures are counted; reaching the threshold opens the breaker.
 *       A success resets the count.</li>
 *   <li>OPEN: calls are rejected until {@code now - lastFailureTime > openTimeout};
 *       the first call after that moves to HALF_OPEN and is let through.</li>
 *   <li>HALF_OPEN: exactly one trial is in flight. Success closes the breaker,
 *       failure re-opens it and restarts the timeout. A trial that reports no
 *       outcome within the open timeout is replaced by a new one.</li>
 * </ul>
 * </p>
 * <p>
 * <b>Thread-safety:</b> all methods are synchronized on the breaker.
 * </p>
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String targetId;
    private final int failureThreshold;
    private final Duration openTimeout;
    private final Clock clock;
    private final TransitionListener listener;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;
    private Instant trialGrantedAt;

    public CircuitBreaker(String targetId, CircuitBreakerSettings settings, Clock clock, TransitionListener listener) {
        Preconditions.checkArgument(settings.getFailureThreshold() > 0, "failureThreshold must be positive");
        Preconditions.checkArgument(!settings.getOpenTimeout().isNegative(), "openTimeout must not be negative");
        this.targetId = targetId;
        this.failureThreshold = settings.getFailureThreshold();
        this.openTimeout = settings.getOpenTimeout();
        this.clock = clock;
        this.listener = listener != null ? listener : TransitionListener.NONE;
    }

    public CircuitBreaker(String targetId, CircuitBreakerSettings settings, Clock clock) {
        this(targetId, settings, clock, null);
    }

    /**
     * Checks whether a call may proceed, acquiring the half-open trial if the open
     * timeout has elapsed.
     *
     * @return true if the call may be sent to the target
     */
    public synchronized boolean canExecute() {
        Instant now = clock.instant();
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (openTimeoutElapsed(now)) {
                    transition(CircuitState.HALF_OPEN);
                    trialGrantedAt = now;
                    return true;
                }
                return false;
            case HALF_OPEN:
                if (trialExpired(now)) {
                    log.debug("Half-open trial for {} reported no outcome, granting another", targetId);
                    trialGrantedAt = now;
                    return true;
                }
                return false;
            default:
                throw new IllegalStateException("Unknown state " + state);
        }
    }

    /**
     * Same answer as {@link #canExecute()} without acquiring the trial or changing state.
     */
    public synchronized boolean isCallPermitted() {
        Instant now = clock.instant();
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                return openTimeoutElapsed(now);
            case HALF_OPEN:
                return trialExpired(now);
            default:
                throw new IllegalStateException("Unknown state " + state);
        }
    }

    public synchronized void recordSuccess() {
        switch (state) {
            case CLOSED:
                failureCount = 0;
                break;
            case HALF_OPEN:
                failureCount = 0;
                trialGrantedAt = null;
                transition(CircuitState.CLOSED);
                break;
            case OPEN:
                // completion of a call admitted before the breaker opened
                break;
            default:
                throw new IllegalStateException("Unknown state " + state);
        }
    }

    public synchronized void recordFailure() {
        Instant now = clock.instant();
        failureCount++;
        switch (state) {
            case CLOSED:
                lastFailureTime = now;
                if (failureCount >= failureThreshold) {
                    transition(CircuitState.OPEN);
                }
                break;
            case HALF_OPEN:
                lastFailureTime = now;
                trialGrantedAt = null;
                transition(CircuitState.OPEN);
                break;
            case OPEN:
                break;
            default:
                throw new IllegalStateException("Unknown state " + state);
        }
    }

    private boolean openTimeoutElapsed(Instant now) {
        return lastFailureTime == null || Duration.between(lastFailureTime, now).compareTo(openTimeout) > 0;
    }

    private boolean trialExpired(Instant now) {
        return trialGrantedAt != null && Duration.between(trialGrantedAt, now).compareTo(openTimeout) > 0;
    }

    private void transition(CircuitState next) {
        CircuitState previous = state;
        state = next;
        if (next == CircuitState.OPEN) {
            log.warn("Circuit for {} opened after {} failures", targetId, failureCount);
        } else {
            log.info("Circuit for {} {} -> {}", targetId, previous, next);
        }
        try {
            listener.onTransition(targetId, previous, next);
        } catch (RuntimeException e) {
            log.error("Circuit transition listener failed for {}", targetId, e);
        }
    }

    public String getTargetId() {
        return targetId;
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getOpenTimeout() {
        return openTimeout;
    }

    /**
     * Observer of state changes, invoked while the breaker lock is held.
     */
    @FunctionalInterface
    public interface TransitionListener {
        TransitionListener NONE = (targetId, from, to) -> {
        };

        void onTransition(String targetId, CircuitState from, CircuitState to);
    }
}
