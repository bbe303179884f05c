package fun.fengwk.rex.core.service.pool;

/**
 * Consulted before an engine instance grows its working memory.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface ResourceLimiter {

    ResourceLimiter ALLOW_ALL = (instanceId, currentBytes, desiredBytes) -> true;

    boolean allowGrowth(String instanceId, long currentBytes, long desiredBytes);

}
