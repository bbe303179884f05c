package fun.fengwk.rex.core.service.pool;

import fun.fengwk.rex.core.service.engine.EngineException;
import fun.fengwk.rex.core.service.engine.ExtractionEngine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded pool of sandboxed extraction engine instances.
 *
 * <p>Lifecycle model:
 * <ul>
 *     <li>Reserve a slot before creating an instance, so {@code idle + checkedOut <= maxSize} holds
 *     under concurrency.</li>
 *     <li>Borrow from the idle queue -> run under the epoch timeout -> record usage -> release.</li>
 *     <li>Unhealthy or retired instances are destroyed on release and replaced on the maintenance
 *     executor.</li>
 * </ul>
 *
 * @author fengwk
 */
@Slf4j
public class ExtractionInstancePool {

    private static final long WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);
    private static final double HIGH_MEMORY_RATIO = 0.8D;

    private final String poolName;
    private final PoolConfig config;
    private final EngineLoader engineLoader;
    private final ResourceLimiter resourceLimiter;
    private final Clock clock;
    private final PoolEventListener eventListener;
    private final Executor maintenanceExecutor;
    private final ExecutorService engineExecutor;

    /**
     * Idle instances ready for checkout.
     */
    private final BlockingQueue<PooledInstance> idleInstances;

    /**
     * Every live instance, idle or checked out.
     */
    private final Set<PooledInstance> allInstances = ConcurrentHashMap.newKeySet();

    /**
     * Reserved slots, including instances still being created.
     */
    private final AtomicInteger slotCount = new AtomicInteger(0);
    private final AtomicInteger checkedOutCount = new AtomicInteger(0);
    private final AtomicInteger instanceIdGen = new AtomicInteger(1);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private final AtomicLong created = new AtomicLong();
    private final AtomicLong destroyed = new AtomicLong();
    private final AtomicLong creationFailures = new AtomicLong();
    private final AtomicLong epochTimeouts = new AtomicLong();
    private final AtomicLong exhaustedAcquisitions = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong acquisitions = new AtomicLong();
    private final AtomicLong totalAcquireWaitNanos = new AtomicLong();
    private final AtomicLong executions = new AtomicLong();
    private final AtomicLong totalExecutionNanos = new AtomicLong();

    private volatile ScheduledExecutorService healthMonitor;

    public ExtractionInstancePool(
        String poolName,
        PoolConfig config,
        EngineLoader engineLoader,
        ResourceLimiter resourceLimiter,
        Clock clock,
        PoolEventListener eventListener,
        Executor maintenanceExecutor
    ) {
        if (config == null || engineLoader == null || clock == null) {
            throw new IllegalArgumentException("pool config, engine loader and clock are required");
        }
        config.validate();
        this.poolName = poolName == null || poolName.isBlank() ? "extraction" : poolName;
        this.config = config;
        this.engineLoader = engineLoader;
        this.resourceLimiter = resourceLimiter == null ? ResourceLimiter.ALLOW_ALL : resourceLimiter;
        this.clock = clock;
        this.eventListener = eventListener == null ? PoolEventListener.NOOP : eventListener;
        this.idleInstances = new LinkedBlockingQueue<>(config.getMaxSize());
        this.engineExecutor = Executors.newCachedThreadPool(daemonThreadFactory("rex-engine-worker-"));
        this.maintenanceExecutor = maintenanceExecutor == null
            ? Executors.newSingleThreadExecutor(daemonThreadFactory("rex-pool-maintenance-"))
            : maintenanceExecutor;
    }

    /**
     * Creates {@code initialSize} instances. Must be called after construction.
     */
    public void warmUp() {
        ensureOpen();
        int warmed = 0;
        for (int i = slotCount.get(); i < config.getInitialSize(); i++) {
            PooledInstance instance = tryCreateInstance();
            if (instance == null) {
                break;
            }
            if (!idleInstances.offer(instance)) {
                destroyInstance(instance, "warmup overflow");
                throw new IllegalStateException("failed to warm up " + poolName + " instance pool");
            }
            warmed++;
        }
        log.info("instance pool warmed up, pool={}, instances={}, maxSize={}", poolName, warmed, config.getMaxSize());
        emit(PoolEventType.POOL_WARMUP, "", Map.of("instances", warmed, "maxSize", config.getMaxSize()));
    }

    public InstanceLease acquire() {
        return acquire(config.getAcquireTimeout());
    }

    /**
     * Checks out a healthy instance, creating one when the pool has room, otherwise waiting up to
     * {@code maxWait} for a release.
     *
     * @throws PoolExhaustedException when nothing became available in time
     * @throws InstanceCreationException when the engine loader failed
     */
    public InstanceLease acquire(Duration maxWait) {
        long startNanos = System.nanoTime();
        long waitNanos = maxWait == null || maxWait.isNegative() ? 0L : maxWait.toNanos();
        long deadlineNanos = startNanos + waitNanos;
        while (true) {
            ensureOpen();
            PooledInstance instance = idleInstances.poll();
            if (instance == null) {
                instance = tryCreateInstance();
            }
            if (instance == null) {
                long remainingNanos = deadlineNanos - System.nanoTime();
                if (remainingNanos <= 0) {
                    exhaustedAcquisitions.incrementAndGet();
                    log.info(
                        "instance acquire timeout, pool={}, waitMs={}, instances={}, checkedOut={}",
                        poolName,
                        TimeUnit.NANOSECONDS.toMillis(waitNanos),
                        allInstances.size(),
                        checkedOutCount.get()
                    );
                    emit(PoolEventType.POOL_EXHAUSTED, "", Map.of("waitMs", TimeUnit.NANOSECONDS.toMillis(waitNanos)));
                    throw new PoolExhaustedException(poolName + " instance pool exhausted");
                }
                instance = pollIdle(Math.min(remainingNanos, WAIT_SLICE_NANOS));
                if (instance == null) {
                    continue;
                }
            }
            if (!isHealthy(instance, config)) {
                emit(PoolEventType.INSTANCE_UNHEALTHY, instance.getId(), instanceMetadata(instance));
                destroyInstance(instance, "unhealthy on acquire");
                continue;
            }
            return checkout(instance, startNanos);
        }
    }

    /**
     * Returns the instance to the idle set when healthy, otherwise destroys it and schedules a
     * replacement. Releasing the same lease twice is a no-op.
     */
    public void release(InstanceLease lease) {
        if (lease == null || !lease.markReleased()) {
            return;
        }
        PooledInstance instance = lease.rawInstance();
        checkedOutCount.decrementAndGet();
        if (shutdown.get()) {
            destroyInstance(instance, "pool shutdown");
            return;
        }
        if (lease.isRetired()) {
            destroyInstance(instance, "retired");
            scheduleReplacement();
            return;
        }
        if (!isHealthy(instance, config)) {
            log.debug("instance unhealthy on release, pool={}, instance={}", poolName, instance);
            emit(PoolEventType.INSTANCE_UNHEALTHY, instance.getId(), instanceMetadata(instance));
            destroyInstance(instance, "unhealthy on release");
            scheduleReplacement();
            return;
        }
        if (!idleInstances.offer(instance)) {
            destroyInstance(instance, "idle queue full");
            return;
        }
        emit(PoolEventType.INSTANCE_RELEASED, instance.getId(), Map.of("useCount", instance.getUseCount()));
    }

    /**
     * Runs {@code task} on the engine of a checked-out instance under a hard deadline. On timeout
     * the engine is interrupted and the lease retired, so the instance never returns to the idle set.
     *
     * @throws ExtractionTimeoutException when the deadline passes first
     */
    public <T> T runWithEpochTimeout(InstanceLease lease, Duration timeout, InstanceTask<T> task) {
        PooledInstance instance = lease.instance();
        ExtractionEngine engine = instance.getEngine();
        Duration effectiveTimeout = timeout == null || timeout.compareTo(config.getEpochTimeout()) > 0
            ? config.getEpochTimeout()
            : timeout;
        long startNanos = System.nanoTime();
        Future<T> future;
        try {
            future = engineExecutor.submit(() -> task.run(engine));
        } catch (RejectedExecutionException ex) {
            throw new IllegalStateException(poolName + " engine executor rejected task", ex);
        }
        try {
            return future.get(Math.max(0L, effectiveTimeout.toNanos()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            engine.interrupt();
            future.cancel(true);
            lease.retire();
            epochTimeouts.incrementAndGet();
            log.warn(
                "epoch timeout, pool={}, instance={}, timeoutMs={}",
                poolName,
                instance.getId(),
                effectiveTimeout.toMillis()
            );
            emit(PoolEventType.EPOCH_TIMEOUT, instance.getId(), Map.of("timeoutMs", effectiveTimeout.toMillis()));
            throw new ExtractionTimeoutException(
                "extraction exceeded epoch timeout of " + effectiveTimeout.toMillis() + "ms on instance " + instance.getId()
            );
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new EngineException("engine execution failed: " + cause.getMessage(), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            engine.interrupt();
            future.cancel(true);
            lease.retire();
            log.warn("epoch wait interrupted, pool={}, instance={}", poolName, instance.getId());
            throw new IllegalStateException("interrupted while waiting for engine execution", ex);
        } finally {
            executions.incrementAndGet();
            totalExecutionNanos.addAndGet(System.nanoTime() - startNanos);
        }
    }

    /**
     * An instance is healthy while it is under every per-instance limit.
     */
    public static boolean isHealthy(PooledInstance instance, PoolConfig config) {
        return instance.getUseCount() < config.getMaxUsesPerInstance()
            && instance.getFailureCount() < config.getMaxFailuresPerInstance()
            && instance.getMemoryUsageBytes() < config.getMemoryLimitBytes()
            && instance.getResourceTracker().getGrowFailures() < config.getGrowFailureThreshold();
    }

    /**
     * Samples memory of idle instances and reports it. Healthy instances are left alone.
     *
     * @return total memory of idle instances
     */
    public long triggerMemoryCleanup() {
        long totalMemory = 0L;
        int highMemory = 0;
        long threshold = highMemoryThreshold();
        List<PooledInstance> idle = new ArrayList<>(idleInstances);
        for (PooledInstance instance : idle) {
            long memory = instance.getResourceTracker().getCurrentMemoryBytes();
            totalMemory += memory;
            if (memory > threshold) {
                highMemory++;
            }
        }
        log.info(
            "memory cleanup sampled, pool={}, idleInstances={}, totalMemoryBytes={}, highMemoryInstances={}",
            poolName,
            idle.size(),
            totalMemory,
            highMemory
        );
        emit(PoolEventType.MEMORY_CLEANUP, "", Map.of(
            "idleInstances", idle.size(),
            "totalMemoryBytes", totalMemory,
            "highMemoryInstances", highMemory
        ));
        return totalMemory;
    }

    /**
     * Retires up to {@code count} idle instances and replaces each one right away.
     *
     * @return number of instances retired
     */
    public int clearSome(int count) {
        int cleared = 0;
        for (int i = 0; i < count; i++) {
            PooledInstance instance = idleInstances.poll();
            if (instance == null) {
                break;
            }
            destroyInstance(instance, "cleared");
            replaceNow();
            cleared++;
        }
        log.info("cleared idle instances, pool={}, requested={}, cleared={}", poolName, count, cleared);
        return cleared;
    }

    /**
     * Retires idle instances above 80% of the memory limit and replaces them.
     *
     * @return number of instances retired
     */
    public int clearHighMemoryInstances() {
        long threshold = highMemoryThreshold();
        int cleared = 0;
        for (PooledInstance instance : new ArrayList<>(idleInstances)) {
            if (instance.getResourceTracker().getCurrentMemoryBytes() <= threshold) {
                continue;
            }
            if (idleInstances.remove(instance)) {
                destroyInstance(instance, "high memory");
                replaceNow();
                cleared++;
            }
        }
        if (cleared > 0) {
            log.info("cleared high memory instances, pool={}, cleared={}, thresholdBytes={}", poolName, cleared, threshold);
        }
        return cleared;
    }

    /**
     * Removes idle instances that are unhealthy, too old or idle for too long, and replaces them.
     *
     * @return number of idle instances that passed the check
     */
    public int performHealthChecks() {
        Instant now = clock.instant();
        int healthy = 0;
        int removed = 0;
        for (PooledInstance instance : new ArrayList<>(idleInstances)) {
            String reason = null;
            if (!isHealthy(instance, config)) {
                reason = "unhealthy";
            } else if (instance.age(now).compareTo(config.getMaxInstanceAge()) > 0) {
                reason = "max age exceeded";
            } else if (instance.idleTime(now).compareTo(config.getMaxIdleTime()) > 0) {
                reason = "max idle time exceeded";
            }
            if (reason == null) {
                healthy++;
                continue;
            }
            if (idleInstances.remove(instance)) {
                destroyInstance(instance, reason);
                replaceNow();
                removed++;
            }
        }
        log.debug("health check finished, pool={}, healthy={}, removed={}", poolName, healthy, removed);
        emit(PoolEventType.HEALTH_CHECK, "", Map.of("healthy", healthy, "removed", removed));
        return healthy;
    }

    /**
     * Schedules {@link #performHealthChecks()} every {@code healthCheckInterval}. No-op when the
     * interval is zero or the monitor already runs.
     */
    public synchronized void startHealthMonitor() {
        ensureOpen();
        long intervalMs = config.getHealthCheckInterval().toMillis();
        if (intervalMs <= 0 || healthMonitor != null) {
            return;
        }
        ScheduledExecutorService monitor = Executors.newSingleThreadScheduledExecutor(daemonThreadFactory("rex-pool-health-"));
        monitor.scheduleWithFixedDelay(this::runScheduledHealthCheck, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        healthMonitor = monitor;
        log.info("health monitor started, pool={}, intervalMs={}", poolName, intervalMs);
    }

    public PoolSnapshot snapshot() {
        long successCount = successes.get();
        long failureCount = failures.get();
        long usageCount = successCount + failureCount;
        long acquireCount = acquisitions.get();
        long executionCount = executions.get();
        return PoolSnapshot.builder()
            .idle(idleInstances.size())
            .checkedOut(checkedOutCount.get())
            .total(allInstances.size())
            .maxSize(config.getMaxSize())
            .created(created.get())
            .destroyed(destroyed.get())
            .creationFailures(creationFailures.get())
            .epochTimeouts(epochTimeouts.get())
            .exhaustedAcquisitions(exhaustedAcquisitions.get())
            .successes(successCount)
            .failures(failureCount)
            .successRate(usageCount == 0 ? 1D : successCount / (double) usageCount)
            .avgAcquireWaitMs(acquireCount == 0 ? 0D : totalAcquireWaitNanos.get() / 1_000_000D / acquireCount)
            .avgExecutionMs(executionCount == 0 ? 0D : totalExecutionNanos.get() / 1_000_000D / executionCount)
            .build();
    }

    public PoolConfig getConfig() {
        return config;
    }

    public String getPoolName() {
        return poolName;
    }

    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("shutting down {} instance pool", poolName);
        ScheduledExecutorService monitor = healthMonitor;
        if (monitor != null) {
            monitor.shutdownNow();
        }
        PooledInstance instance;
        while ((instance = idleInstances.poll()) != null) {
            destroyInstance(instance, "pool shutdown");
        }
        // Checked-out instances are destroyed when their leases are released.
        engineExecutor.shutdownNow();
        if (maintenanceExecutor instanceof ExecutorService executorService) {
            executorService.shutdownNow();
        }
        log.info("{} instance pool shutdown completed, checkedOut={}", poolName, checkedOutCount.get());
    }

    void recordUsage(InstanceLease lease, boolean success) {
        PooledInstance instance = lease.rawInstance();
        instance.recordUsage(success, clock.instant());
        if (success) {
            successes.incrementAndGet();
        } else {
            failures.incrementAndGet();
        }
    }

    private InstanceLease checkout(PooledInstance instance, long startNanos) {
        long generation = instance.nextCheckoutGeneration();
        checkedOutCount.incrementAndGet();
        acquisitions.incrementAndGet();
        totalAcquireWaitNanos.addAndGet(System.nanoTime() - startNanos);
        emit(PoolEventType.INSTANCE_ACQUIRED, instance.getId(), Map.of("useCount", instance.getUseCount()));
        return new InstanceLease(this, instance, generation);
    }

    private PooledInstance pollIdle(long timeoutNanos) {
        try {
            return idleInstances.poll(timeoutNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("instance acquire interrupted, pool={}", poolName);
            throw new IllegalStateException("interrupted while waiting for instance", ex);
        }
    }

    /**
     * @return a new instance, or {@code null} when the pool is at capacity
     */
    private PooledInstance tryCreateInstance() {
        if (!reserveSlot()) {
            return null;
        }
        String instanceId = config.getEngineId() + "-" + instanceIdGen.getAndIncrement();
        ResourceTracker tracker = new ResourceTracker(instanceId, config.getMemoryLimitBytes(), resourceLimiter);
        ExtractionEngine engine;
        try {
            engine = engineLoader.load(config.getEngineId(), instanceId, tracker);
            if (engine == null) {
                throw new IllegalStateException("engine loader returned null");
            }
        } catch (RuntimeException ex) {
            releaseSlot();
            creationFailures.incrementAndGet();
            log.warn(
                "create instance failed, pool={}, engine={}, instance={}, error={}",
                poolName,
                config.getEngineId(),
                instanceId,
                ex.getMessage(),
                ex
            );
            throw new InstanceCreationException("failed to create " + config.getEngineId() + " instance: " + ex.getMessage(), ex);
        }
        PooledInstance instance = new PooledInstance(instanceId, engine, tracker, clock.instant());
        allInstances.add(instance);
        created.incrementAndGet();
        log.debug("created instance, pool={}, instance={}", poolName, instanceId);
        emit(PoolEventType.INSTANCE_CREATED, instanceId, Map.of("engineId", config.getEngineId()));
        return instance;
    }

    private void scheduleReplacement() {
        try {
            maintenanceExecutor.execute(this::replaceNow);
        } catch (RejectedExecutionException ex) {
            log.warn("schedule instance replacement rejected, pool={}, error={}", poolName, ex.getMessage());
        }
    }

    private void replaceNow() {
        if (shutdown.get()) {
            return;
        }
        try {
            PooledInstance replacement = tryCreateInstance();
            if (replacement == null) {
                return;
            }
            if (!idleInstances.offer(replacement)) {
                destroyInstance(replacement, "idle queue full");
            }
        } catch (InstanceCreationException ex) {
            log.warn("create replacement instance failed, pool={}, error={}", poolName, ex.getMessage());
        }
    }

    private void destroyInstance(PooledInstance instance, String reason) {
        // Only the first caller removes and closes the instance.
        if (!allInstances.remove(instance)) {
            return;
        }
        try {
            instance.getEngine().close();
        } catch (RuntimeException ex) {
            log.warn("close engine failed, pool={}, instance={}, error={}", poolName, instance.getId(), ex.getMessage());
        } finally {
            releaseSlot();
        }
        destroyed.incrementAndGet();
        log.debug("destroyed instance, pool={}, instance={}, reason={}", poolName, instance, reason);
        Map<String, Object> metadata = instanceMetadata(instance);
        metadata.put("reason", reason);
        emit(PoolEventType.INSTANCE_DESTROYED, instance.getId(), metadata);
    }

    private boolean reserveSlot() {
        while (true) {
            int current = slotCount.get();
            if (current >= config.getMaxSize()) {
                return false;
            }
            if (slotCount.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    private void releaseSlot() {
        slotCount.decrementAndGet();
    }

    private long highMemoryThreshold() {
        return (long) (config.getMemoryLimitBytes() * HIGH_MEMORY_RATIO);
    }

    private void runScheduledHealthCheck() {
        try {
            performHealthChecks();
        } catch (RuntimeException ex) {
            log.error("scheduled health check failed, pool={}", poolName, ex);
        }
    }

    private Map<String, Object> instanceMetadata(PooledInstance instance) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("useCount", instance.getUseCount());
        metadata.put("failureCount", instance.getFailureCount());
        metadata.put("memoryBytes", instance.getMemoryUsageBytes());
        metadata.put("ageMs", instance.age(clock.instant()).toMillis());
        metadata.put("growFailures", instance.getResourceTracker().getGrowFailures());
        return metadata;
    }

    private void emit(PoolEventType type, String instanceId, Map<String, Object> metadata) {
        PoolEvent event = PoolEvent.builder()
            .type(type)
            .instanceId(instanceId)
            .at(clock.instant())
            .metadata(metadata)
            .build();
        try {
            eventListener.onEvent(event);
        } catch (RuntimeException ex) {
            log.warn("pool event listener failed, pool={}, type={}, error={}", poolName, type, ex.getMessage(), ex);
        }
    }

    private void ensureOpen() {
        if (shutdown.get()) {
            throw new IllegalStateException(poolName + " instance pool is shutdown");
        }
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger threadIdGen = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + threadIdGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

}
