package fun.fengwk.rex.core.service.breaker;

/**
 * Best-effort sink for breaker state changes. Invoked after the change is committed.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface CircuitEventListener {

    CircuitEventListener NOOP = event -> {
    };

    void onEvent(CircuitHealthEvent event);

}
