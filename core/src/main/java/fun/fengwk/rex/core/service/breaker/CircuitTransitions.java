package fun.fengwk.rex.core.service.breaker;

import java.time.Duration;
import java.time.Instant;

/**
 * Pure state machine shared by both breaker variants. Callers are responsible for publishing the
 * returned cell atomically.
 *
 * @author fengwk
 */
final class CircuitTransitions {

    private CircuitTransitions() {
    }

    /**
     * A state plus the period it belongs to. The generation changes on every phase transition.
     */
    record StateCell(CircuitState state, long generation, Instant changedAt) {

        static StateCell initial(Instant now) {
            return new StateCell(CircuitState.Closed.INITIAL, 0L, now);
        }

        StateCell moveTo(CircuitState next, Instant now) {
            return new StateCell(next, generation + 1, now);
        }

        StateCell update(CircuitState next) {
            return new StateCell(next, generation, changedAt);
        }

    }

    /**
     * @param permit {@code null} when admission was refused
     */
    record Admission(StateCell next, CircuitPermit permit) {

        boolean admitted() {
            return permit != null;
        }

    }

    static Admission acquire(String name, StateCell cell, CircuitBreakerConfig config, Instant now) {
        CircuitState state = cell.state();
        if (state instanceof CircuitState.Closed) {
            return new Admission(cell, new CircuitPermit(name, cell.generation(), false));
        }
        if (state instanceof CircuitState.Open open) {
            Duration elapsed = Duration.between(open.openedAt(), now);
            if (elapsed.compareTo(config.getOpenCooldown()) < 0) {
                return new Admission(cell, null);
            }
            StateCell next = cell.moveTo(new CircuitState.HalfOpen(1, now), now);
            return new Admission(next, new CircuitPermit(name, next.generation(), true));
        }
        CircuitState.HalfOpen halfOpen = (CircuitState.HalfOpen) state;
        if (halfOpen.inFlightTrials() >= config.getHalfOpenMaxInFlight()) {
            return new Admission(cell, null);
        }
        StateCell next = cell.update(new CircuitState.HalfOpen(halfOpen.inFlightTrials() + 1, halfOpen.enteredAt()));
        return new Admission(next, new CircuitPermit(name, cell.generation(), true));
    }

    static StateCell success(StateCell cell, CircuitPermit permit, Instant now) {
        if (isStale(cell, permit)) {
            return cell;
        }
        CircuitState state = cell.state();
        if (state instanceof CircuitState.Closed closed) {
            return cell.update(new CircuitState.Closed(0, closed.successCount() + 1, closed.lastFailureTime()));
        }
        if (state instanceof CircuitState.HalfOpen && permit.trial()) {
            return cell.moveTo(CircuitState.Closed.INITIAL, now);
        }
        return cell;
    }

    static StateCell failure(StateCell cell, CircuitPermit permit, CircuitBreakerConfig config, Instant now) {
        if (isStale(cell, permit)) {
            return cell;
        }
        CircuitState state = cell.state();
        if (state instanceof CircuitState.Closed closed) {
            int failures = closed.failureCount() + 1;
            if (failures >= config.getFailureThreshold()) {
                return cell.moveTo(new CircuitState.Open(now, failures), now);
            }
            return cell.update(new CircuitState.Closed(failures, closed.successCount(), now));
        }
        if (state instanceof CircuitState.HalfOpen && permit.trial()) {
            return cell.moveTo(new CircuitState.Open(now, 1), now);
        }
        return cell;
    }

    static StateCell release(StateCell cell, CircuitPermit permit) {
        if (isStale(cell, permit) || !permit.trial()) {
            return cell;
        }
        if (cell.state() instanceof CircuitState.HalfOpen halfOpen) {
            return cell.update(new CircuitState.HalfOpen(Math.max(0, halfOpen.inFlightTrials() - 1), halfOpen.enteredAt()));
        }
        return cell;
    }

    static boolean isTrip(StateCell before, StateCell after) {
        return before.state().phase() != CircuitPhase.OPEN && after.state().phase() == CircuitPhase.OPEN;
    }

    static int failureCountOf(CircuitState state) {
        if (state instanceof CircuitState.Closed closed) {
            return closed.failureCount();
        }
        if (state instanceof CircuitState.Open open) {
            return open.failureCount();
        }
        return 0;
    }

    static long successCountOf(CircuitState state) {
        return state instanceof CircuitState.Closed closed ? closed.successCount() : 0L;
    }

    static int inFlightTrialsOf(CircuitState state) {
        return state instanceof CircuitState.HalfOpen halfOpen ? halfOpen.inFlightTrials() : 0;
    }

    private static boolean isStale(StateCell cell, CircuitPermit permit) {
        if (permit == null) {
            throw new IllegalArgumentException("permit must not be null");
        }
        return permit.generation() != cell.generation();
    }

}
