package fun.fengwk.rex.core.service.pool;

/**
 * @author fengwk
 */
public enum PoolEventType {

    POOL_WARMUP,
    INSTANCE_CREATED,
    INSTANCE_ACQUIRED,
    INSTANCE_RELEASED,
    INSTANCE_UNHEALTHY,
    INSTANCE_DESTROYED,
    POOL_EXHAUSTED,
    EPOCH_TIMEOUT,
    MEMORY_CLEANUP,
    HEALTH_CHECK

}
