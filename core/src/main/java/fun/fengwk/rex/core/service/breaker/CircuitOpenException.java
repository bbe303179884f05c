package fun.fengwk.rex.core.service.breaker;

import lombok.Getter;

/**
 * Raised when a breaker refuses admission.
 *
 * @author fengwk
 */
@Getter
public class CircuitOpenException extends RuntimeException {

    private final String breakerName;
    private final CircuitPhase phase;

    public CircuitOpenException(String breakerName, CircuitPhase phase) {
        super("circuit breaker " + breakerName + " rejected call in state " + phase);
        this.breakerName = breakerName;
        this.phase = phase;
    }

}
