package fun.fengwk.rex.core.service.pool;

import fun.fengwk.rex.core.MutableClock;
import fun.fengwk.rex.core.service.engine.EngineException;
import fun.fengwk.rex.core.service.engine.ExtractedDocument;
import fun.fengwk.rex.core.service.engine.ResourceLimitExceededException;
import fun.fengwk.rex.core.service.gate.Decision;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class ExtractionInstancePoolTest {

    private static final InstanceTask<ExtractedDocument> EXTRACT =
        engine -> engine.extract(new byte[0], "https://example.com/a", Decision.RAW);

    private final MutableClock clock = MutableClock.startingNow();
    private final FakeEngineLoader engineLoader = new FakeEngineLoader();
    private final List<PoolEvent> events = new CopyOnWriteArrayList<>();

    private ExtractionInstancePool pool;

    @AfterEach
    public void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    @Test
    public void shouldCreateInitialInstancesOnWarmUp() {
        pool = newPool(PoolConfig.builder().initialSize(2).maxSize(4).build());

        PoolSnapshot snapshot = pool.snapshot();
        assertThat(snapshot.getIdle()).isEqualTo(2);
        assertThat(snapshot.getTotal()).isEqualTo(2);
        assertThat(snapshot.getCreated()).isEqualTo(2);
        assertThat(snapshot.getSuccessRate()).isEqualTo(1D);
        assertThat(events).extracting(PoolEvent::getType)
            .containsExactly(PoolEventType.INSTANCE_CREATED, PoolEventType.INSTANCE_CREATED, PoolEventType.POOL_WARMUP);
        assertThat(events.get(0).getInstanceId()).isEqualTo("jsoup-1");
    }

    @Test
    public void shouldReuseReleasedInstance() {
        pool = newPool(PoolConfig.builder().initialSize(1).maxSize(1).build());

        String firstId;
        try (InstanceLease lease = pool.acquire()) {
            firstId = lease.instanceId();
            ExtractedDocument document = pool.runWithEpochTimeout(lease, Duration.ofSeconds(1), EXTRACT);
            lease.recordUsage(true);
            assertThat(document.getText()).isEqualTo("extracted by jsoup-1");
        }
        try (InstanceLease lease = pool.acquire()) {
            assertThat(lease.instanceId()).isEqualTo(firstId);
            assertThat(lease.instance().getUseCount()).isEqualTo(1);
        }
        assertThat(pool.snapshot().getCreated()).isEqualTo(1);
        assertThat(pool.snapshot().getSuccesses()).isEqualTo(1);
    }

    @Test
    public void shouldFailFastWhenExhausted() {
        pool = newPool(PoolConfig.builder().initialSize(1).maxSize(1).build());
        InstanceLease held = pool.acquire();

        assertThatThrownBy(() -> pool.acquire(Duration.ofMillis(100)))
            .isInstanceOf(PoolExhaustedException.class);

        assertThat(pool.snapshot().getExhaustedAcquisitions()).isEqualTo(1);
        assertThat(pool.snapshot().getCheckedOut()).isEqualTo(1);
        assertThat(events).extracting(PoolEvent::getType).contains(PoolEventType.POOL_EXHAUSTED);
        held.close();
    }

    @Test
    public void shouldHandReleasedInstanceToWaiter() throws Exception {
        pool = newPool(PoolConfig.builder().initialSize(1).maxSize(1).build());
        InstanceLease held = pool.acquire();

        CompletableFuture<InstanceLease> waiter = CompletableFuture.supplyAsync(() -> pool.acquire(Duration.ofSeconds(5)));
        Thread.sleep(100);
        held.close();

        InstanceLease lease = waiter.get(5, TimeUnit.SECONDS);
        assertThat(lease.instanceId()).isEqualTo("jsoup-1");
        lease.close();
    }

    @Test
    public void shouldReplaceInstanceAfterMaxUses() {
        pool = newPool(PoolConfig.builder().initialSize(1).maxSize(1).maxUsesPerInstance(2).build());

        for (int i = 0; i < 2; i++) {
            try (InstanceLease lease = pool.acquire()) {
                assertThat(lease.instanceId()).isEqualTo("jsoup-1");
                lease.recordUsage(true);
            }
        }

        try (InstanceLease lease = pool.acquire()) {
            assertThat(lease.instanceId()).isEqualTo("jsoup-2");
        }
        assertThat(engineLoader.engine("jsoup-1").isClosed()).isTrue();
        assertThat(pool.snapshot().getDestroyed()).isEqualTo(1);
        assertThat(events).extracting(PoolEvent::getType)
            .contains(PoolEventType.INSTANCE_UNHEALTHY, PoolEventType.INSTANCE_DESTROYED);
    }

    @Test
    public void shouldReplaceInstanceAfterMaxFailures() {
        pool = newPool(PoolConfig.builder().initialSize(1).maxSize(1).maxFailuresPerInstance(1).build());

        try (InstanceLease lease = pool.acquire()) {
            lease.recordUsage(false);
        }

        try (InstanceLease lease = pool.acquire()) {
            assertThat(lease.instanceId()).isEqualTo("jsoup-2");
        }
        assertThat(pool.snapshot().getFailures()).isEqualTo(1);
        assertThat(pool.snapshot().getSuccessRate()).isEqualTo(0D);
    }

    @Test
    public void shouldInterruptAndRetireInstanceOnEpochTimeout() {
        pool = newPool(PoolConfig.builder().initialSize(1).maxSize(1).epochTimeout(Duration.ofMillis(200)).build());
        FakeExtractionEngine engine = engineLoader.engine("jsoup-1");
        engine.blockUntilInterrupted = true;

        InstanceLease lease = pool.acquire();
        // A longer caller budget is capped by the pool's epoch timeout.
        assertThatThrownBy(() -> pool.runWithEpochTimeout(lease, Duration.ofMinutes(1), EXTRACT))
            .isInstanceOf(ExtractionTimeoutException.class)
            .hasMessageContaining("200ms");
        assertThat(engine.isInterrupted()).isTrue();
        assertThat(lease.isRetired()).isTrue();
        lease.close();

        assertThat(engine.isClosed()).isTrue();
        assertThat(pool.snapshot().getEpochTimeouts()).isEqualTo(1);
        try (InstanceLease next = pool.acquire()) {
            assertThat(next.instanceId()).isEqualTo("jsoup-2");
        }
        assertThat(events).extracting(PoolEvent::getType).contains(PoolEventType.EPOCH_TIMEOUT);
    }

    @Test
    public void shouldPropagateEngineFailure() {
        pool = newPool(PoolConfig.builder().initialSize(1).maxSize(1).build());
        EngineException failure = new EngineException("malformed input");
        engineLoader.engine("jsoup-1").failure = failure;

        try (InstanceLease lease = pool.acquire()) {
            assertThatThrownBy(() -> pool.runWithEpochTimeout(lease, Duration.ofSeconds(1), EXTRACT)).isSameAs(failure);
        }
    }

    @Test
    public void shouldReleaseSlotWhenCreationFails() {
        pool = newPool(PoolConfig.builder().initialSize(0).maxSize(1).build());
        engineLoader.failure = new IllegalStateException("sandbox unavailable");

        assertThatThrownBy(() -> pool.acquire(Duration.ZERO))
            .isInstanceOf(InstanceCreationException.class)
            .hasMessageContaining("sandbox unavailable")
            .hasCauseInstanceOf(IllegalStateException.class);

        engineLoader.failure = null;
        try (InstanceLease lease = pool.acquire(Duration.ZERO)) {
            assertThat(lease.instanceId()).isEqualTo("jsoup-2");
        }
        assertThat(pool.snapshot().getCreationFailures()).isEqualTo(1);
        assertThat(pool.snapshot().getCreated()).isEqualTo(1);
    }

    @Test
    public void shouldRetireInstanceAfterRepeatedGrowFailures() {
        pool = newPool(PoolConfig.builder()
            .initialSize(1)
            .maxSize(1)
            .memoryLimitBytes(1000L)
            .growFailureThreshold(2)
            .maxFailuresPerInstance(10)
            .build());
        FakeExtractionEngine engine = engineLoader.engine("jsoup-1");
        engine.growTo = 2000L;

        try (InstanceLease lease = pool.acquire()) {
            for (int i = 0; i < 2; i++) {
                assertThatThrownBy(() -> pool.runWithEpochTimeout(lease, Duration.ofSeconds(1), EXTRACT))
                    .isInstanceOf(ResourceLimitExceededException.class);
                lease.recordUsage(false);
            }
        }

        assertThat(engine.getResourceTracker().getGrowFailures()).isEqualTo(2);
        assertThat(engine.isClosed()).isTrue();
        assertThat(pool.snapshot().getDestroyed()).isEqualTo(1);
    }

    @Test
    public void shouldRecomputeMemoryOnRecordedUsage() {
        pool = newPool(PoolConfig.builder().initialSize(1).maxSize(1).build());
        engineLoader.engine("jsoup-1").growTo = 500L;

        try (InstanceLease lease = pool.acquire()) {
            pool.runWithEpochTimeout(lease, Duration.ofSeconds(1), EXTRACT);
            assertThat(lease.instance().getMemoryUsageBytes()).isZero();
            lease.recordUsage(true);
            assertThat(lease.instance().getMemoryUsageBytes()).isEqualTo(500L);
        }
    }

    @Test
    public void shouldRejectUseOfReleasedLease() {
        pool = newPool(PoolConfig.builder().initialSize(1).maxSize(1).build());
        InstanceLease lease = pool.acquire();

        lease.close();
        lease.close();

        assertThat(lease.isReleased()).isTrue();
        assertThatThrownBy(lease::instance).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> lease.recordUsage(true)).isInstanceOf(IllegalStateException.class);
        assertThat(pool.snapshot().getCheckedOut()).isZero();
        assertThat(pool.snapshot().getIdle()).isEqualTo(1);
    }

    @Test
    public void shouldClearAndReplaceIdleInstances() {
        pool = newPool(PoolConfig.builder().initialSize(3).maxSize(3).build());

        int cleared = pool.clearSome(2);

        assertThat(cleared).isEqualTo(2);
        PoolSnapshot snapshot = pool.snapshot();
        assertThat(snapshot.getIdle()).isEqualTo(3);
        assertThat(snapshot.getCreated()).isEqualTo(5);
        assertThat(snapshot.getDestroyed()).isEqualTo(2);
    }

    @Test
    public void shouldClearNothingFromEmptyPool() {
        pool = newPool(PoolConfig.builder().initialSize(0).maxSize(2).build());

        assertThat(pool.clearSome(3)).isZero();
    }

    @Test
    public void shouldClearOnlyHighMemoryInstances() {
        pool = newPool(PoolConfig.builder().initialSize(2).maxSize(2).memoryLimitBytes(1000L).build());
        InstanceLease first = pool.acquire();
        InstanceLease second = pool.acquire();
        first.instance().getResourceTracker().requestGrowth(900L);
        second.instance().getResourceTracker().requestGrowth(100L);
        String heavyId = first.instanceId();
        first.close();
        second.close();

        assertThat(pool.triggerMemoryCleanup()).isEqualTo(1000L);
        assertThat(pool.clearHighMemoryInstances()).isEqualTo(1);

        assertThat(engineLoader.engine(heavyId).isClosed()).isTrue();
        assertThat(pool.snapshot().getIdle()).isEqualTo(2);
        assertThat(pool.triggerMemoryCleanup()).isEqualTo(100L);
        assertThat(events).extracting(PoolEvent::getType).contains(PoolEventType.MEMORY_CLEANUP);
    }

    @Test
    public void shouldReplaceIdleInstancesPastIdleTime() {
        pool = newPool(PoolConfig.builder()
            .initialSize(2)
            .maxSize(2)
            .maxIdleTime(Duration.ofMinutes(30))
            .maxInstanceAge(Duration.ofHours(1))
            .build());

        assertThat(pool.performHealthChecks()).isEqualTo(2);
        clock.advance(Duration.ofMinutes(31));
        assertThat(pool.performHealthChecks()).isZero();

        PoolSnapshot snapshot = pool.snapshot();
        assertThat(snapshot.getIdle()).isEqualTo(2);
        assertThat(snapshot.getDestroyed()).isEqualTo(2);
        assertThat(snapshot.getCreated()).isEqualTo(4);
        PoolEvent last = events.get(events.size() - 1);
        assertThat(last.getType()).isEqualTo(PoolEventType.HEALTH_CHECK);
        assertThat(last.getMetadata()).containsEntry("healthy", 0).containsEntry("removed", 2);
        assertThat(pool.performHealthChecks()).isEqualTo(2);
    }

    @Test
    public void shouldReplaceIdleInstancesPastMaxAge() {
        pool = newPool(PoolConfig.builder()
            .initialSize(1)
            .maxSize(1)
            .maxIdleTime(Duration.ofHours(2))
            .maxInstanceAge(Duration.ofHours(1))
            .build());

        clock.advance(Duration.ofMinutes(61));

        assertThat(pool.performHealthChecks()).isZero();
        assertThat(engineLoader.engine("jsoup-1").isClosed()).isTrue();
        try (InstanceLease lease = pool.acquire()) {
            assertThat(lease.instanceId()).isEqualTo("jsoup-2");
        }
    }

    @Test
    public void shouldRejectInvalidConfig() {
        PoolConfig config = PoolConfig.builder().initialSize(5).maxSize(2).build();

        assertThatThrownBy(() -> newPool(config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("initialSize");
    }

    @Test
    public void shouldKeepWorkingWhenEventListenerFails() {
        pool = new ExtractionInstancePool(
            "test",
            PoolConfig.builder().initialSize(1).maxSize(1).build(),
            engineLoader,
            ResourceLimiter.ALLOW_ALL,
            clock,
            event -> {
                throw new IllegalStateException("sink down");
            },
            Runnable::run
        );
        pool.warmUp();

        try (InstanceLease lease = pool.acquire()) {
            assertThat(lease.instanceId()).isEqualTo("jsoup-1");
        }
    }

    @Test
    public void shouldDestroyOutstandingInstanceAfterShutdown() {
        pool = newPool(PoolConfig.builder().initialSize(2).maxSize(2).build());
        InstanceLease lease = pool.acquire();

        pool.shutdown();

        assertThatThrownBy(() -> pool.acquire()).isInstanceOf(IllegalStateException.class);
        lease.close();
        assertThat(engineLoader.getEngines()).allMatch(FakeExtractionEngine::isClosed);
        assertThat(pool.snapshot().getTotal()).isZero();
    }

    @Test
    public void shouldNeverExceedMaxSizeUnderConcurrency() throws Exception {
        pool = newPool(PoolConfig.builder().initialSize(0).maxSize(3).build());
        AtomicInteger inUse = new AtomicInteger();
        AtomicInteger maxInUse = new AtomicInteger();
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        try (InstanceLease lease = pool.acquire(Duration.ofSeconds(5))) {
                            maxInUse.accumulateAndGet(inUse.incrementAndGet(), Math::max);
                            assertThat(pool.snapshot().getTotal()).isLessThanOrEqualTo(3);
                            lease.recordUsage(true);
                            inUse.decrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        PoolSnapshot snapshot = pool.snapshot();
        assertThat(maxInUse.get()).isLessThanOrEqualTo(3);
        assertThat(snapshot.getCreated()).isLessThanOrEqualTo(3);
        assertThat(snapshot.getCheckedOut()).isZero();
        assertThat(snapshot.getSuccesses()).isEqualTo(400);
    }

    private ExtractionInstancePool newPool(PoolConfig config) {
        ExtractionInstancePool created = new ExtractionInstancePool(
            "test",
            config,
            engineLoader,
            ResourceLimiter.ALLOW_ALL,
            clock,
            events::add,
            Runnable::run
        );
        created.warmUp();
        return created;
    }

}
