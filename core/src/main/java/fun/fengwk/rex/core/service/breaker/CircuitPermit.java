package fun.fengwk.rex.core.service.breaker;

/**
 * Admission ticket handed out by {@link CircuitBreaker#tryAcquire()}.
 *
 * <p>The generation ties the permit to the state period it was issued in; outcomes reported with a
 * permit from an earlier period are ignored.
 *
 * @author fengwk
 */
public record CircuitPermit(String breakerName, long generation, boolean trial) {

}
