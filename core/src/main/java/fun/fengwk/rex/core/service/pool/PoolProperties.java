package fun.fengwk.rex.core.service.pool;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Engine instance pool configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "rex.pool")
public class PoolProperties {

    private String engineId = "jsoup";

    private int initialSize = 2;

    private int maxSize = 8;

    private long maxUsesPerInstance = 1000;

    private int maxFailuresPerInstance = 5;

    /**
     * Working memory ceiling per instance.
     */
    private long memoryLimitBytes = 256L * 1024L * 1024L;

    private int growFailureThreshold = 10;

    /**
     * Hard wall-clock limit of a single engine execution.
     */
    private long epochTimeoutMs = 30000;

    /**
     * Interval of the periodic health check, 0 disables it.
     */
    private long healthCheckIntervalMs = 30000;

    /**
     * Wait budget when every instance is checked out.
     */
    private long acquireTimeoutMs = 5000;

    private long maxInstanceAgeMs = 3600000;

    private long maxIdleTimeMs = 1800000;

    public PoolConfig toPoolConfig() {
        PoolConfig config = PoolConfig.builder()
            .engineId(engineId)
            .initialSize(initialSize)
            .maxSize(maxSize)
            .maxUsesPerInstance(maxUsesPerInstance)
            .maxFailuresPerInstance(maxFailuresPerInstance)
            .memoryLimitBytes(memoryLimitBytes)
            .growFailureThreshold(growFailureThreshold)
            .epochTimeout(Duration.ofMillis(epochTimeoutMs))
            .healthCheckInterval(Duration.ofMillis(healthCheckIntervalMs))
            .acquireTimeout(Duration.ofMillis(acquireTimeoutMs))
            .maxInstanceAge(Duration.ofMillis(maxInstanceAgeMs))
            .maxIdleTime(Duration.ofMillis(maxIdleTimeMs))
            .build();
        config.validate();
        return config;
    }

}
