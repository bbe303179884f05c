package fun.fengwk.rex.core.service.pool;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time pool metrics.
 *
 * @author fengwk
 */
@Value
@Builder
public class PoolSnapshot {

    int idle;
    int checkedOut;
    int total;
    int maxSize;
    long created;
    long destroyed;
    long creationFailures;
    long epochTimeouts;
    long exhaustedAcquisitions;
    long successes;
    long failures;
    double successRate;
    double avgAcquireWaitMs;
    double avgExecutionMs;

}
