package fun.fengwk.rex.core.service.breaker;

import java.time.Instant;

/**
 * Immutable circuit breaker state.
 *
 * <p>Legal edges are {@code CLOSED -> OPEN}, {@code OPEN -> HALF_OPEN}, {@code HALF_OPEN -> CLOSED}
 * and {@code HALF_OPEN -> OPEN}.
 *
 * @author fengwk
 */
public interface CircuitState {

    CircuitPhase phase();

    /**
     * @param lastFailureTime {@code null} until the first failure of the current closed period
     */
    record Closed(int failureCount, long successCount, Instant lastFailureTime) implements CircuitState {

        static final Closed INITIAL = new Closed(0, 0L, null);

        @Override
        public CircuitPhase phase() {
            return CircuitPhase.CLOSED;
        }

    }

    record Open(Instant openedAt, int failureCount) implements CircuitState {

        @Override
        public CircuitPhase phase() {
            return CircuitPhase.OPEN;
        }

    }

    record HalfOpen(int inFlightTrials, Instant enteredAt) implements CircuitState {

        @Override
        public CircuitPhase phase() {
            return CircuitPhase.HALF_OPEN;
        }

    }

}
