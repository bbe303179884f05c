package fun.fengwk.rex.core.service.pool;

/**
 * Best-effort sink for pool lifecycle events.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface PoolEventListener {

    PoolEventListener NOOP = event -> {
    };

    void onEvent(PoolEvent event);

}
