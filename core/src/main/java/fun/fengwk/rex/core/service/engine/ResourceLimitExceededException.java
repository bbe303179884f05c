package fun.fengwk.rex.core.service.engine;

import lombok.Getter;

/**
 * Memory growth was denied mid-execution.
 *
 * @author fengwk
 */
@Getter
public class ResourceLimitExceededException extends EngineException {

    private final long requestedBytes;
    private final long limitBytes;

    public ResourceLimitExceededException(String instanceId, long requestedBytes, long limitBytes) {
        super("memory growth to " + requestedBytes + " bytes denied for instance " + instanceId
            + ", limit " + limitBytes + " bytes");
        this.requestedBytes = requestedBytes;
        this.limitBytes = limitBytes;
    }

}
