package fun.fengwk.rex.core.service.breaker;

import fun.fengwk.rex.core.service.breaker.CircuitTransitions.Admission;
import fun.fengwk.rex.core.service.breaker.CircuitTransitions.StateCell;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock-guarded breaker that counts every decision and reports phase changes to a
 * {@link CircuitEventListener}.
 *
 * <p>The listener runs outside the lock, after the new state is visible to other callers. A failing
 * listener is logged and otherwise ignored.
 *
 * @author fengwk
 */
@Slf4j
public class MonitoredCircuitBreaker implements CircuitBreaker {

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final CircuitEventListener eventListener;
    private final ReentrantLock lock = new ReentrantLock();

    private StateCell cell;
    private long trips;
    private long rejections;
    private long admissions;
    private long totalSuccesses;
    private long totalFailures;
    private long releases;
    private long staleOutcomes;

    public MonitoredCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this(name, config, clock, CircuitEventListener.NOOP);
    }

    public MonitoredCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, CircuitEventListener eventListener) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("breaker name must not be blank");
        }
        if (config == null || clock == null) {
            throw new IllegalArgumentException("breaker config and clock are required");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.eventListener = eventListener == null ? CircuitEventListener.NOOP : eventListener;
        this.cell = StateCell.initial(clock.instant());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CircuitPermit tryAcquire() {
        StateCell before;
        Admission admission;
        lock.lock();
        try {
            before = cell;
            admission = CircuitTransitions.acquire(name, before, config, clock.instant());
            if (admission.admitted()) {
                cell = admission.next();
                admissions++;
                countTrip(before, cell);
            } else {
                rejections++;
            }
        } finally {
            lock.unlock();
        }
        if (!admission.admitted()) {
            throw new CircuitOpenException(name, before.state().phase());
        }
        publish(before, admission.next());
        return admission.permit();
    }

    @Override
    public void onSuccess(CircuitPermit permit) {
        checkOwner(permit);
        StateCell before;
        StateCell after;
        lock.lock();
        try {
            before = cell;
            totalSuccesses++;
            after = CircuitTransitions.success(before, permit, clock.instant());
            commit(before, after, permit);
        } finally {
            lock.unlock();
        }
        publish(before, after);
    }

    @Override
    public void onFailure(CircuitPermit permit) {
        checkOwner(permit);
        StateCell before;
        StateCell after;
        lock.lock();
        try {
            before = cell;
            totalFailures++;
            after = CircuitTransitions.failure(before, permit, config, clock.instant());
            commit(before, after, permit);
        } finally {
            lock.unlock();
        }
        publish(before, after);
    }

    @Override
    public void release(CircuitPermit permit) {
        checkOwner(permit);
        lock.lock();
        try {
            releases++;
            cell = CircuitTransitions.release(cell, permit);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitState state() {
        lock.lock();
        try {
            return cell.state();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            CircuitState state = cell.state();
            return CircuitBreakerSnapshot.builder()
                .name(name)
                .phase(state.phase())
                .failureCount(CircuitTransitions.failureCountOf(state))
                .successCount(CircuitTransitions.successCountOf(state))
                .inFlightTrials(CircuitTransitions.inFlightTrialsOf(state))
                .trips(trips)
                .rejections(rejections)
                .totalSuccesses(totalSuccesses)
                .totalFailures(totalFailures)
                .lastTransitionAt(cell.changedAt())
                .build();
        } finally {
            lock.unlock();
        }
    }

    public long getAdmissions() {
        lock.lock();
        try {
            return admissions;
        } finally {
            lock.unlock();
        }
    }

    public long getReleases() {
        lock.lock();
        try {
            return releases;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Outcomes reported with a permit from an earlier state period.
     */
    public long getStaleOutcomes() {
        lock.lock();
        try {
            return staleOutcomes;
        } finally {
            lock.unlock();
        }
    }

    private void commit(StateCell before, StateCell after, CircuitPermit permit) {
        if (permit.generation() != before.generation()) {
            staleOutcomes++;
        }
        cell = after;
        countTrip(before, after);
    }

    private void countTrip(StateCell before, StateCell after) {
        if (CircuitTransitions.isTrip(before, after)) {
            trips++;
        }
    }

    private void publish(StateCell before, StateCell after) {
        CircuitPhase from = before.state().phase();
        CircuitPhase to = after.state().phase();
        if (from == to) {
            return;
        }
        log.info("[Breaker:{}] state changed, from={}, to={}, at={}", name, from, to, after.changedAt());
        CircuitHealthEvent event = new CircuitHealthEvent(
            name,
            from,
            to,
            CircuitTransitions.failureCountOf(after.state()),
            after.changedAt()
        );
        try {
            eventListener.onEvent(event);
        } catch (RuntimeException ex) {
            log.warn("[Breaker:{}] health event listener failed, event={}, error={}", name, event, ex.getMessage(), ex);
        }
    }

    private void checkOwner(CircuitPermit permit) {
        if (permit == null || !name.equals(permit.breakerName())) {
            throw new IllegalArgumentException("permit does not belong to breaker " + name);
        }
    }

}
