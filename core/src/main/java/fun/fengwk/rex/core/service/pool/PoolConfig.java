package fun.fengwk.rex.core.service.pool;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable configuration of an {@link ExtractionInstancePool}.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
public class PoolConfig {

    /**
     * Instances created eagerly on warm-up.
     */
    @Builder.Default
    int initialSize = 2;

    /**
     * Hard ceiling of idle plus checked-out instances.
     */
    @Builder.Default
    int maxSize = 8;

    @Builder.Default
    long maxUsesPerInstance = 1000L;

    @Builder.Default
    int maxFailuresPerInstance = 5;

    /**
     * Working memory ceiling of a single instance.
     */
    @Builder.Default
    long memoryLimitBytes = 256L * 1024L * 1024L;

    /**
     * Denied growth requests after which an instance is considered unhealthy.
     */
    @Builder.Default
    int growFailureThreshold = 10;

    @Builder.Default
    Duration epochTimeout = Duration.ofSeconds(30);

    /**
     * Zero disables periodic health checks.
     */
    @Builder.Default
    Duration healthCheckInterval = Duration.ofSeconds(30);

    /**
     * Wait budget of {@link ExtractionInstancePool#acquire()}.
     */
    @Builder.Default
    Duration acquireTimeout = Duration.ofSeconds(5);

    @Builder.Default
    Duration maxInstanceAge = Duration.ofHours(1);

    @Builder.Default
    Duration maxIdleTime = Duration.ofMinutes(30);

    @Builder.Default
    String engineId = "jsoup";

    public void validate() {
        if (maxSize < 1) {
            throw new IllegalArgumentException("pool maxSize must be positive: " + maxSize);
        }
        if (initialSize < 0 || initialSize > maxSize) {
            throw new IllegalArgumentException("pool initialSize must lie in [0, maxSize]: " + initialSize);
        }
        if (maxUsesPerInstance < 1 || maxFailuresPerInstance < 1 || growFailureThreshold < 1) {
            throw new IllegalArgumentException("pool per-instance limits must be positive");
        }
        if (memoryLimitBytes < 1) {
            throw new IllegalArgumentException("pool memoryLimitBytes must be positive: " + memoryLimitBytes);
        }
        requirePositive("epochTimeout", epochTimeout);
        requirePositive("maxInstanceAge", maxInstanceAge);
        requirePositive("maxIdleTime", maxIdleTime);
        if (acquireTimeout == null || acquireTimeout.isNegative()) {
            throw new IllegalArgumentException("pool acquireTimeout must not be negative: " + acquireTimeout);
        }
        if (healthCheckInterval == null || healthCheckInterval.isNegative()) {
            throw new IllegalArgumentException("pool healthCheckInterval must not be negative: " + healthCheckInterval);
        }
        if (engineId == null || engineId.isBlank()) {
            throw new IllegalArgumentException("pool engineId must not be blank");
        }
    }

    private static void requirePositive(String name, Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("pool " + name + " must be positive: " + duration);
        }
    }

}
