package fun.fengwk.rex.core.service.pool;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Memory accounting of one engine instance.
 *
 * <p>Memory is a high-water mark: it grows on approved requests and never shrinks for the lifetime
 * of the instance.
 *
 * @author fengwk
 */
@Slf4j
public class ResourceTracker {

    private final String instanceId;
    private final long memoryLimitBytes;
    private final ResourceLimiter resourceLimiter;
    private final AtomicLong currentMemoryBytes = new AtomicLong();
    private final AtomicInteger growFailures = new AtomicInteger();

    public ResourceTracker(String instanceId, long memoryLimitBytes, ResourceLimiter resourceLimiter) {
        this.instanceId = instanceId;
        this.memoryLimitBytes = memoryLimitBytes;
        this.resourceLimiter = resourceLimiter == null ? ResourceLimiter.ALLOW_ALL : resourceLimiter;
    }

    /**
     * Asks to raise the working memory to {@code desiredTotalBytes}.
     *
     * @return {@code false} when the request exceeds the ceiling or the limiter denies it, in which
     * case the grow failure counter is incremented
     */
    public boolean requestGrowth(long desiredTotalBytes) {
        long current = currentMemoryBytes.get();
        if (desiredTotalBytes <= current) {
            return true;
        }
        if (desiredTotalBytes > memoryLimitBytes
            || !resourceLimiter.allowGrowth(instanceId, current, desiredTotalBytes)) {
            int failures = growFailures.incrementAndGet();
            log.debug(
                "memory growth denied, instance={}, currentBytes={}, desiredBytes={}, limitBytes={}, growFailures={}",
                instanceId,
                current,
                desiredTotalBytes,
                memoryLimitBytes,
                failures
            );
            return false;
        }
        currentMemoryBytes.accumulateAndGet(desiredTotalBytes, Math::max);
        return true;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public long getMemoryLimitBytes() {
        return memoryLimitBytes;
    }

    public long getCurrentMemoryBytes() {
        return currentMemoryBytes.get();
    }

    public int getGrowFailures() {
        return growFailures.get();
    }

}
