package fun.fengwk.rex.core.service.breaker;

/**
 * Fail-fast admission control for a single backend.
 *
 * <p>None of the methods block. Every permit returned by {@link #tryAcquire()} must be settled with
 * exactly one of {@link #onSuccess}, {@link #onFailure} or {@link #release}.
 *
 * @author fengwk
 */
public interface CircuitBreaker {

    String name();

    /**
     * Admits a call or fails immediately. An open breaker whose cooldown has elapsed moves to
     * half-open here.
     *
     * @throws CircuitOpenException when open, or half-open at trial capacity
     */
    CircuitPermit tryAcquire();

    void onSuccess(CircuitPermit permit);

    void onFailure(CircuitPermit permit);

    /**
     * Gives the permit back without recording an outcome, used when the call never reached the
     * backend.
     */
    void release(CircuitPermit permit);

    CircuitState state();

    default CircuitPhase phase() {
        return state().phase();
    }

    CircuitBreakerSnapshot snapshot();

}
