package fun.fengwk.rex.core.service.breaker;

import fun.fengwk.rex.core.service.breaker.CircuitTransitions.Admission;
import fun.fengwk.rex.core.service.breaker.CircuitTransitions.StateCell;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Lock-free breaker for hot paths. Every transition is a single compare-and-swap on an immutable
 * state cell.
 *
 * @author fengwk
 */
@Slf4j
public class AtomicCircuitBreaker implements CircuitBreaker {

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final AtomicReference<StateCell> cell;

    private final AtomicLong trips = new AtomicLong();
    private final AtomicLong rejections = new AtomicLong();
    private final AtomicLong totalSuccesses = new AtomicLong();
    private final AtomicLong totalFailures = new AtomicLong();

    public AtomicCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("breaker name must not be blank");
        }
        if (config == null || clock == null) {
            throw new IllegalArgumentException("breaker config and clock are required");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.cell = new AtomicReference<>(StateCell.initial(clock.instant()));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CircuitPermit tryAcquire() {
        while (true) {
            StateCell current = cell.get();
            Admission admission = CircuitTransitions.acquire(name, current, config, clock.instant());
            if (!admission.admitted()) {
                rejections.incrementAndGet();
                throw new CircuitOpenException(name, current.state().phase());
            }
            if (admission.next() == current || cell.compareAndSet(current, admission.next())) {
                logTransition(current, admission.next());
                return admission.permit();
            }
        }
    }

    @Override
    public void onSuccess(CircuitPermit permit) {
        checkOwner(permit);
        totalSuccesses.incrementAndGet();
        apply(current -> CircuitTransitions.success(current, permit, clock.instant()));
    }

    @Override
    public void onFailure(CircuitPermit permit) {
        checkOwner(permit);
        totalFailures.incrementAndGet();
        apply(current -> CircuitTransitions.failure(current, permit, config, clock.instant()));
    }

    @Override
    public void release(CircuitPermit permit) {
        checkOwner(permit);
        apply(current -> CircuitTransitions.release(current, permit));
    }

    @Override
    public CircuitState state() {
        return cell.get().state();
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        StateCell current = cell.get();
        CircuitState state = current.state();
        return CircuitBreakerSnapshot.builder()
            .name(name)
            .phase(state.phase())
            .failureCount(CircuitTransitions.failureCountOf(state))
            .successCount(CircuitTransitions.successCountOf(state))
            .inFlightTrials(CircuitTransitions.inFlightTrialsOf(state))
            .trips(trips.get())
            .rejections(rejections.get())
            .totalSuccesses(totalSuccesses.get())
            .totalFailures(totalFailures.get())
            .lastTransitionAt(current.changedAt())
            .build();
    }

    private void apply(UnaryOperator<StateCell> transition) {
        while (true) {
            StateCell current = cell.get();
            StateCell next = transition.apply(current);
            if (next == current) {
                return;
            }
            if (cell.compareAndSet(current, next)) {
                logTransition(current, next);
                return;
            }
        }
    }

    private void logTransition(StateCell before, StateCell after) {
        CircuitPhase from = before.state().phase();
        CircuitPhase to = after.state().phase();
        if (from == to) {
            return;
        }
        if (CircuitTransitions.isTrip(before, after)) {
            trips.incrementAndGet();
        }
        Instant at = after.changedAt();
        log.info("[Breaker:{}] state changed, from={}, to={}, at={}", name, from, to, at);
    }

    private void checkOwner(CircuitPermit permit) {
        if (permit == null || !name.equals(permit.breakerName())) {
            throw new IllegalArgumentException("permit does not belong to breaker " + name);
        }
    }

}
