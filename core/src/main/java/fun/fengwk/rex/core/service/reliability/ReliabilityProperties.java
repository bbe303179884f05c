package fun.fengwk.rex.core.service.reliability;

import fun.fengwk.rex.core.service.breaker.CircuitBreakerConfig;
import fun.fengwk.rex.core.service.gate.Decision;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Retry, escalation and breaker configuration of the reliable extractor.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "rex.reliability")
public class ReliabilityProperties {

    private int rawMaxAttempts = 2;

    private int probesMaxAttempts = 2;

    private int headlessMaxAttempts = 1;

    private long initialBackoffMs = 200;

    private long maxBackoffMs = 2000;

    private double backoffMultiplier = 1.5D;

    private boolean backoffJitter = false;

    /**
     * Probe results below this quality score escalate.
     */
    private double qualityThreshold = 0.6D;

    /**
     * Return the best low quality probe result instead of failing when every mode is exhausted.
     */
    private boolean gracefulDegradation = true;

    private boolean escalationEnabled = true;

    /**
     * Deadline applied when the caller passes none.
     */
    private long defaultDeadlineMs = 60000;

    private long headlessTimeoutMs = 30000;

    private BreakerSettings rawBreaker = new BreakerSettings(5, 30000, 3);

    private BreakerSettings probesBreaker = new BreakerSettings(5, 30000, 3);

    private BreakerSettings headlessBreaker = new BreakerSettings(3, 60000, 2);

    public RetryPolicy toRetryPolicy() {
        return RetryPolicy.builder()
            .rawMaxAttempts(rawMaxAttempts)
            .probesMaxAttempts(probesMaxAttempts)
            .headlessMaxAttempts(headlessMaxAttempts)
            .initialBackoff(Duration.ofMillis(initialBackoffMs))
            .maxBackoff(Duration.ofMillis(maxBackoffMs))
            .backoffMultiplier(backoffMultiplier)
            .jitter(backoffJitter)
            .build();
    }

    public Map<Decision, CircuitBreakerConfig> toBreakerConfigs() {
        Map<Decision, CircuitBreakerConfig> configs = new EnumMap<>(Decision.class);
        configs.put(Decision.RAW, rawBreaker.toConfig());
        configs.put(Decision.PROBES_FIRST, probesBreaker.toConfig());
        configs.put(Decision.HEADLESS, headlessBreaker.toConfig());
        return configs;
    }

    public void validate() {
        if (qualityThreshold < 0D || qualityThreshold > 1D) {
            throw new IllegalArgumentException("qualityThreshold must lie in [0, 1]: " + qualityThreshold);
        }
        if (defaultDeadlineMs <= 0 || headlessTimeoutMs <= 0) {
            throw new IllegalArgumentException("defaultDeadlineMs and headlessTimeoutMs must be positive");
        }
        toRetryPolicy();
        toBreakerConfigs();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BreakerSettings {

        private int failureThreshold;

        private long openCooldownMs;

        private int halfOpenMaxInFlight;

        public CircuitBreakerConfig toConfig() {
            return CircuitBreakerConfig.builder()
                .failureThreshold(failureThreshold)
                .openCooldown(Duration.ofMillis(openCooldownMs))
                .halfOpenMaxInFlight(halfOpenMaxInFlight)
                .build();
        }

    }

}
