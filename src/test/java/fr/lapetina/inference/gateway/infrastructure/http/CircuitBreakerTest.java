package fr.lapetina.inference.gateway.infrastructure.http;

import fr.lapetina.inference.gateway.support.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerTest {

    private ManualClock clock;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        // 3 failures to open, 30s recovery, 2 trial successes to close
        circuitBreaker = new CircuitBreaker("test-backend", 3, Duration.ofSeconds(30), 2, clock);
    }

    private void openCircuit() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
    }

    @Test
    @DisplayName("should start in CLOSED state")
    void shouldStartClosed() {
        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.allowRequest()).isTrue();
    }

    @Test
    @DisplayName("should open after threshold consecutive failures")
    void shouldOpenAfterThresholdFailures() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.CLOSED);

        circuitBreaker.recordFailure();

        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.allowRequest()).isFalse();
    }

    @Test
    @DisplayName("should reset the failure count on success")
    void shouldResetFailureCountOnSuccess() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        circuitBreaker.recordSuccess();
        circuitBreaker.recordFailure();

        assertThat(circuitBreaker.getConsecutiveFailures()).isEqualTo(1);
        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("should allow trial calls once the recovery timeout elapsed")
    void shouldTransitionToHalfOpen() {
        openCircuit();

        clock.advance(Duration.ofSeconds(29));
        assertThat(circuitBreaker.allowRequest()).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(circuitBreaker.allowRequest()).isTrue();
        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
    }

    @Test
    @DisplayName("should close after enough trial successes")
    void shouldCloseAfterTrialSuccesses() {
        openCircuit();
        clock.advance(Duration.ofSeconds(30));
        circuitBreaker.allowRequest();

        circuitBreaker.recordSuccess();
        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        circuitBreaker.recordSuccess();

        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("should reopen when a trial call fails")
    void shouldReopenOnTrialFailure() {
        openCircuit();
        clock.advance(Duration.ofSeconds(30));
        circuitBreaker.allowRequest();

        circuitBreaker.recordFailure();

        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.allowRequest()).isFalse();
    }
}
