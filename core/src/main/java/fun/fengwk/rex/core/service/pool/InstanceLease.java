package fun.fengwk.rex.core.service.pool;

import fun.fengwk.rex.core.service.engine.ExtractionEngine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive checkout of a {@link PooledInstance}. Closing the lease releases the instance back to
 * its pool; a retired lease destroys the instance instead.
 *
 * @author fengwk
 */
public class InstanceLease implements AutoCloseable {

    private final ExtractionInstancePool pool;
    private final PooledInstance instance;
    private final long generation;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile boolean retired;

    InstanceLease(ExtractionInstancePool pool, PooledInstance instance, long generation) {
        this.pool = pool;
        this.instance = instance;
        this.generation = generation;
    }

    public PooledInstance instance() {
        checkActive();
        return instance;
    }

    public ExtractionEngine engine() {
        return instance().getEngine();
    }

    public String instanceId() {
        return instance.getId();
    }

    public long generation() {
        return generation;
    }

    /**
     * Updates usage counters and memory of the checked-out instance.
     */
    public void recordUsage(boolean success) {
        checkActive();
        pool.recordUsage(this, success);
    }

    /**
     * Marks the instance as unusable, it is destroyed on release.
     */
    public void retire() {
        retired = true;
    }

    public boolean isRetired() {
        return retired;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        pool.release(this);
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    PooledInstance rawInstance() {
        return instance;
    }

    private void checkActive() {
        if (released.get() || instance.getCheckoutGeneration() != generation) {
            throw new IllegalStateException("lease of instance " + instance.getId() + " is no longer active");
        }
    }

}
