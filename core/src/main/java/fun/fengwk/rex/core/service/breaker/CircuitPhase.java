package fun.fengwk.rex.core.service.breaker;

/**
 * @author fengwk
 */
public enum CircuitPhase {

    CLOSED,
    OPEN,
    HALF_OPEN

}
