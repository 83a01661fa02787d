package io.steadyloop.retry;

import io.steadyloop.model.TaskCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Three-state breaker for one category. OPEN rejects calls until {@code recoveryTimeout} has
 * passed since the last failure; the next call then moves it to HALF_OPEN, which admits up to
 * {@code halfOpenAttempts} concurrent trial calls.
 */
public final class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final TaskCategory category;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int halfOpenAttempts;
    private final Clock clock;
    private final TransitionListener listener;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Long lastFailureAtMs;
    private int halfOpenInFlight;
    private int halfOpenSuccesses;

    public CircuitBreaker(TaskCategory category, int failureThreshold, Duration recoveryTimeout,
                          int halfOpenAttempts, Clock clock) {
        this(category, failureThreshold, recoveryTimeout, halfOpenAttempts, clock, null);
    }

    public CircuitBreaker(TaskCategory category, int failureThreshold, Duration recoveryTimeout,
                          int halfOpenAttempts, Clock clock, TransitionListener listener) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1: " + failureThreshold);
        }
        if (halfOpenAttempts < 1) {
            throw new IllegalArgumentException("halfOpenAttempts must be >= 1: " + halfOpenAttempts);
        }
        this.category = category;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout == null ? Duration.ZERO : recoveryTimeout;
        this.halfOpenAttempts = halfOpenAttempts;
        this.clock = clock;
        this.listener = listener;
    }

    public synchronized boolean canAttempt() {
        if (state == CircuitState.OPEN) {
            long since = clock.millis() - (lastFailureAtMs == null ? 0L : lastFailureAtMs);
            if (since < recoveryTimeout.toMillis()) {
                return false;
            }
            transition(CircuitState.HALF_OPEN);
            halfOpenInFlight = 0;
            halfOpenSuccesses = 0;
        }
        if (state == CircuitState.HALF_OPEN) {
            if (halfOpenInFlight >= halfOpenAttempts) {
                return false;
            }
            halfOpenInFlight++;
        }
        return true;
    }

    public synchronized void recordSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            halfOpenInFlight = Math.max(0, halfOpenInFlight - 1);
            halfOpenSuccesses++;
            if (halfOpenSuccesses >= halfOpenAttempts) {
                failureCount = 0;
                transition(CircuitState.CLOSED);
            }
        } else if (state == CircuitState.CLOSED && failureCount > 0) {
            failureCount--;
        }
    }

    public synchronized void recordFailure() {
        lastFailureAtMs = clock.millis();
        if (state == CircuitState.HALF_OPEN) {
            halfOpenInFlight = 0;
            halfOpenSuccesses = 0;
            transition(CircuitState.OPEN);
            return;
        }
        failureCount++;
        if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
            transition(CircuitState.OPEN);
        }
    }

    public synchronized void reset() {
        failureCount = 0;
        lastFailureAtMs = null;
        halfOpenInFlight = 0;
        halfOpenSuccesses = 0;
        if (state != CircuitState.CLOSED) {
            transition(CircuitState.CLOSED);
        }
    }

    public synchronized CircuitState state() {
        return state;
    }

    public synchronized BreakerSnapshot snapshot() {
        return new BreakerSnapshot(
                category,
                state,
                failureCount,
                failureThreshold,
                recoveryTimeout.toMillis(),
                lastFailureAtMs,
                halfOpenAttempts,
                halfOpenSuccesses
        );
    }

    private void transition(CircuitState next) {
        CircuitState previous = state;
        state = next;
        if (next == CircuitState.OPEN) {
            log.warn("Circuit {} opened after {} failure(s)", category.key(), failureCount);
        } else {
            log.info("Circuit {} {} -> {}", category.key(), previous, next);
        }
        if (listener != null) {
            listener.onTransition(category, previous, next);
        }
    }

    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(TaskCategory category, CircuitState from, CircuitState to);
    }
}
