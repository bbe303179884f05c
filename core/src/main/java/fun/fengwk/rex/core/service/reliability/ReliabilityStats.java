package fun.fengwk.rex.core.service.reliability;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregate counters of a {@link ReliableExtractor}. Counters only grow.
 *
 * @author fengwk
 */
@Value
@Builder
public class ReliabilityStats {

    long totalAttempts;

    long successes;

    /**
     * Modes that ended without an accepted document.
     */
    long failures;

    /**
     * Retries per completed call, attempts beyond the first one.
     */
    double avgRetries;

    long circuitBreakerTrips;

    long totalExtractions;

    long escalations;

    long degradedResults;

}
