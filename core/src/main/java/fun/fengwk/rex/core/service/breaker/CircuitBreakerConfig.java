package fun.fengwk.rex.core.service.breaker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * @author fengwk
 */
@Value
public class CircuitBreakerConfig {

    int failureThreshold;
    Duration openCooldown;
    int halfOpenMaxInFlight;

    @Builder
    public CircuitBreakerConfig(int failureThreshold, Duration openCooldown, int halfOpenMaxInFlight) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
        }
        if (openCooldown == null || openCooldown.isNegative() || openCooldown.isZero()) {
            throw new IllegalArgumentException("openCooldown must be positive: " + openCooldown);
        }
        if (halfOpenMaxInFlight < 1) {
            throw new IllegalArgumentException("halfOpenMaxInFlight must be positive: " + halfOpenMaxInFlight);
        }
        this.failureThreshold = failureThreshold;
        this.openCooldown = openCooldown;
        this.halfOpenMaxInFlight = halfOpenMaxInFlight;
    }

}
