package fun.fengwk.rex.core.service.pool;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * @author fengwk
 */
@Value
@Builder
public class PoolEvent {

    PoolEventType type;

    /**
     * Empty for pool-wide events.
     */
    @Builder.Default
    String instanceId = "";

    Instant at;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

}
