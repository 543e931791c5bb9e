package fr.lapetina.inference.gateway.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit breaker guarding the upstream backend.
 *
 * States:
 * - CLOSED: calls pass through, consecutive failures are counted
 * - OPEN: calls are refused until the recovery timeout elapses
 * - HALF_OPEN: trial calls pass; enough successes close, any failure reopens
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
    private final Duration recoveryTimeout;
    private final int successThresholdInHalfOpen;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicInteger halfOpenSuccesses = new AtomicInteger(0);
    private volatile Instant openedAt;

    public CircuitBreaker(
            String backendName,
            int failureThreshold,
            Duration recoveryTimeout,
            int successThresholdInHalfOpen,
            Clock clock
    ) {
        if (failureThreshold <= 0 || successThresholdInHalfOpen <= 0) {
            throw new IllegalArgumentException("Circuit breaker thresholds must be > 0");
        }
        this.backendName = backendName;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.successThresholdInHalfOpen = successThresholdInHalfOpen;
        this.clock = clock;
    }

    public CircuitBreaker(String backendName, int failureThreshold, Duration recoveryTimeout) {
        this(backendName, failureThreshold, recoveryTimeout, 1, Clock.systemUTC());
    }

    /**
     * @return true if the call may go upstream
     */
    public boolean allowRequest() {
        return currentState() != State.OPEN;
    }

    public void recordSuccess() {
        switch (state.get()) {
            case CLOSED -> consecutiveFailures.set(0);
            case HALF_OPEN -> {
                if (halfOpenSuccesses.incrementAndGet() >= successThresholdInHalfOpen
                        && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
                    consecutiveFailures.set(0);
                    log.info("Circuit breaker CLOSED after recovery: backend={}", backendName);
                }
            }
            default -> {
                // A call admitted before the circuit opened; nothing to update
            }
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
                log.warn("Circuit breaker OPENED: backend={}, failures={}, recoverySeconds={}",
                        backendName, failures, recoveryTimeout.toSeconds());
            }
        }
    }

    /**
     * Returns the state, moving OPEN to HALF_OPEN once the recovery timeout elapsed.
     */
    public State currentState() {
        if (state.get() == State.OPEN
                && !clock.instant().isBefore(openedAt.plus(recoveryTimeout))
                && state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
            halfOpenSuccesses.set(0);
            log.info("Circuit breaker HALF_OPEN: backend={}", backendName);
        }
        return state.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
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
