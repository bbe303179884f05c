package fun.fengwk.rex.core.service.breaker;

import fun.fengwk.rex.core.service.gate.Decision;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One breaker per extraction backend, built once at startup and injected where needed.
 *
 * @author fengwk
 */
public class CircuitBreakerRegistry {

    private final Map<Decision, CircuitBreaker> breakers;

    public CircuitBreakerRegistry(Map<Decision, CircuitBreaker> breakers) {
        EnumMap<Decision, CircuitBreaker> copy = new EnumMap<>(Decision.class);
        for (Decision decision : Decision.values()) {
            CircuitBreaker breaker = breakers == null ? null : breakers.get(decision);
            if (breaker == null) {
                throw new IllegalArgumentException("missing circuit breaker for mode " + decision.getValue());
            }
            copy.put(decision, breaker);
        }
        this.breakers = Collections.unmodifiableMap(copy);
    }

    /**
     * Static and probe backends sit on the hot path and use the lock-free variant, the headless
     * backend uses the monitored one.
     */
    public static CircuitBreakerRegistry create(
        Map<Decision, CircuitBreakerConfig> configs,
        Clock clock,
        CircuitEventListener eventListener
    ) {
        EnumMap<Decision, CircuitBreaker> breakers = new EnumMap<>(Decision.class);
        for (Decision decision : Decision.values()) {
            CircuitBreakerConfig config = configs.get(decision);
            if (config == null) {
                throw new IllegalArgumentException("missing circuit breaker config for mode " + decision.getValue());
            }
            if (decision == Decision.HEADLESS) {
                breakers.put(decision, new MonitoredCircuitBreaker(decision.getValue(), config, clock, eventListener));
            } else {
                breakers.put(decision, new AtomicCircuitBreaker(decision.getValue(), config, clock));
            }
        }
        return new CircuitBreakerRegistry(breakers);
    }

    public CircuitBreaker get(Decision decision) {
        return breakers.get(decision);
    }

    public Map<Decision, CircuitBreakerSnapshot> snapshots() {
        EnumMap<Decision, CircuitBreakerSnapshot> snapshots = new EnumMap<>(Decision.class);
        breakers.forEach((decision, breaker) -> snapshots.put(decision, breaker.snapshot()));
        return Collections.unmodifiableMap(snapshots);
    }

}
