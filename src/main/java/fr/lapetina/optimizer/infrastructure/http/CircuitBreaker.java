package fr.lapetina.optimizer.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Protects a generation backend from calls while it is failing.
 *
 * States:
 * - CLOSED: calls pass through, consecutive failures are counted
 * - OPEN: the failure threshold was reached, calls are rejected until the recovery delay elapses
 * - HALF_OPEN: trial calls pass; enough successes close the circuit, any failure reopens it
 *
 * Thread-safe via atomic operations.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String backendName;
    private final int failureThreshold;
    private final Duration recoveryDelay;
    private final int halfOpenSuccessThreshold;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicInteger halfOpenSuccesses = new AtomicInteger(0);
    private volatile Instant openedAt;

    public CircuitBreaker(String backendName, int failureThreshold, Duration recoveryDelay,
                          int halfOpenSuccessThreshold, Clock clock) {
        if (failureThreshold <= 0 || halfOpenSuccessThreshold <= 0) {
            throw new IllegalArgumentException("Circuit breaker thresholds must be positive");
        }
        if (recoveryDelay == null || recoveryDelay.isNegative() || recoveryDelay.isZero()) {
            throw new IllegalArgumentException("Circuit breaker recovery delay must be positive: " + recoveryDelay);
        }
        this.backendName = backendName;
        this.failureThreshold = failureThreshold;
        this.recoveryDelay = recoveryDelay;
        this.halfOpenSuccessThreshold = halfOpenSuccessThreshold;
        this.clock = clock;
    }

    public CircuitBreaker(String backendName, int failureThreshold, Duration recoveryDelay) {
        this(backendName, failureThreshold, recoveryDelay, 1, Clock.systemUTC());
    }

    /**
     * @return true if the call may proceed, false while the circuit is open
     */
    public boolean allowRequest() {
        return getState() != State.OPEN;
    }

    public void recordSuccess() {
        State current = state.get();
        if (current == State.CLOSED) {
            consecutiveFailures.set(0);
            return;
        }
        if (current == State.HALF_OPEN
                && halfOpenSuccesses.incrementAndGet() >= halfOpenSuccessThreshold
                && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
            consecutiveFailures.set(0);
            log.info("Circuit breaker CLOSED after recovery: backend={}", backendName);
        }
    }

    public void recordFailure() {
        State current = state.get();
        if (current == State.HALF_OPEN) {
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                openedAt = clock.instant();
                log.warn("Circuit breaker OPENED (trial call failed): backend={}", backendName);
            }
            return;
        }
        if (current == State.CLOSED) {
            int failures = consecutiveFailures.incrementAndGet();
            if (failures >= failureThreshold && state.compareAndSet(State.CLOSED, State.OPEN)) {
                openedAt = clock.instant();
                log.warn("Circuit breaker OPENED: backend={}, failures={}", backendName, failures);
            }
        }
    }

    /**
     * Current state. An open circuit whose recovery delay has elapsed moves to HALF_OPEN.
     */
    public State getState() {
        if (state.get() == State.OPEN && openedAt != null
                && !clock.instant().isBefore(openedAt.plus(recoveryDelay))
                && state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
            halfOpenSuccesses.set(0);
            log.info("Circuit breaker HALF_OPEN: backend={}", backendName);
        }
        return state.get();
    }

    public void reset() {
        state.set(State.CLOSED);
        consecutiveFailures.set(0);
        halfOpenSuccesses.set(0);
        openedAt = null;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public String getBackendName() {
        return backendName;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "backend='" + backendName + '\'' +
                ", state=" + state.get() +
                ", failures=" + consecutiveFailures.get() +
                '}';
    }
}
