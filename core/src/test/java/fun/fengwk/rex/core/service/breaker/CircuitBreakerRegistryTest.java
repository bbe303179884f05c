package fun.fengwk.rex.core.service.breaker;

import fun.fengwk.rex.core.MutableClock;
import fun.fengwk.rex.core.service.gate.Decision;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class CircuitBreakerRegistryTest {

    private static CircuitBreakerConfig config(int threshold) {
        return CircuitBreakerConfig.builder()
            .failureThreshold(threshold)
            .openCooldown(Duration.ofSeconds(30))
            .halfOpenMaxInFlight(1)
            .build();
    }

    @Test
    public void shouldCreateOneIndependentBreakerPerMode() {
        Map<Decision, CircuitBreakerConfig> configs = new EnumMap<>(Decision.class);
        configs.put(Decision.RAW, config(1));
        configs.put(Decision.PROBES_FIRST, config(1));
        configs.put(Decision.HEADLESS, config(1));

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.create(configs, MutableClock.startingNow(), CircuitEventListener.NOOP);
        CircuitBreaker raw = registry.get(Decision.RAW);
        raw.onFailure(raw.tryAcquire());

        assertThat(raw).isInstanceOf(AtomicCircuitBreaker.class);
        assertThat(registry.get(Decision.HEADLESS)).isInstanceOf(MonitoredCircuitBreaker.class);
        assertThat(registry.get(Decision.RAW)).isSameAs(raw);
        assertThat(registry.snapshots().get(Decision.RAW).getPhase()).isEqualTo(CircuitPhase.OPEN);
        assertThat(registry.snapshots().get(Decision.PROBES_FIRST).getPhase()).isEqualTo(CircuitPhase.CLOSED);
        assertThat(registry.snapshots().get(Decision.HEADLESS).getName()).isEqualTo("headless");
    }

    @Test
    public void shouldRequireConfigForEveryMode() {
        Map<Decision, CircuitBreakerConfig> configs = new EnumMap<>(Decision.class);
        configs.put(Decision.RAW, config(1));

        assertThatThrownBy(() -> CircuitBreakerRegistry.create(configs, MutableClock.startingNow(), CircuitEventListener.NOOP))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("probes");
    }

}
