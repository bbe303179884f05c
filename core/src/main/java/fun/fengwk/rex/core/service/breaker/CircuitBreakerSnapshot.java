package fun.fengwk.rex.core.service.breaker;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only view of a breaker for health reporting.
 *
 * @author fengwk
 */
@Value
@Builder
public class CircuitBreakerSnapshot {

    String name;
    CircuitPhase phase;
    int failureCount;
    long successCount;
    int inFlightTrials;
    long trips;
    long rejections;
    long totalSuccesses;
    long totalFailures;
    Instant lastTransitionAt;

}
