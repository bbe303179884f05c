package fun.fengwk.rex.core.service.breaker;

import java.time.Instant;

/**
 * @author fengwk
 */
public record CircuitHealthEvent(String breakerName, CircuitPhase from, CircuitPhase to, int failureCount, Instant at) {

}
