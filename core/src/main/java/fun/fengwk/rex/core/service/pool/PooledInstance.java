package fun.fengwk.rex.core.service.pool;

import fun.fengwk.rex.core.service.engine.ExtractionEngine;

import java.time.Duration;
import java.time.Instant;

/**
 * A pool slot holding one engine instance.
 *
 * <p>Mutable fields are only written by the holder of the current checkout, hand-over between
 * holders goes through the pool's idle queue.
 *
 * @author fengwk
 */
public class PooledInstance {

    private final String id;
    private final ExtractionEngine engine;
    private final ResourceTracker resourceTracker;
    private final Instant createdAt;

    private Instant lastUsedAt;
    private long useCount;
    private int failureCount;
    private long memoryUsageBytes;
    private long checkoutGeneration;

    PooledInstance(String id, ExtractionEngine engine, ResourceTracker resourceTracker, Instant createdAt) {
        this.id = id;
        this.engine = engine;
        this.resourceTracker = resourceTracker;
        this.createdAt = createdAt;
        this.lastUsedAt = createdAt;
    }

    void recordUsage(boolean success, Instant now) {
        lastUsedAt = now;
        useCount++;
        if (!success) {
            failureCount++;
        }
        memoryUsageBytes = resourceTracker.getCurrentMemoryBytes();
    }

    long nextCheckoutGeneration() {
        return ++checkoutGeneration;
    }

    long getCheckoutGeneration() {
        return checkoutGeneration;
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    public Duration idleTime(Instant now) {
        return Duration.between(lastUsedAt, now);
    }

    public String getId() {
        return id;
    }

    public ExtractionEngine getEngine() {
        return engine;
    }

    public ResourceTracker getResourceTracker() {
        return resourceTracker;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastUsedAt() {
        return lastUsedAt;
    }

    public long getUseCount() {
        return useCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public long getMemoryUsageBytes() {
        return memoryUsageBytes;
    }

    @Override
    public String toString() {
        return "PooledInstance{id=" + id + ", useCount=" + useCount + ", failureCount=" + failureCount
            + ", memoryUsageBytes=" + memoryUsageBytes + "}";
    }

}
