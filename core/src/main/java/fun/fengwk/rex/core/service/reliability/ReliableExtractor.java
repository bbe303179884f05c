package fun.fengwk.rex.core.service.reliability;

import fun.fengwk.rex.core.service.breaker.CircuitBreaker;
import fun.fengwk.rex.core.service.breaker.CircuitBreakerRegistry;
import fun.fengwk.rex.core.service.breaker.CircuitBreakerSnapshot;
import fun.fengwk.rex.core.service.breaker.CircuitOpenException;
import fun.fengwk.rex.core.service.breaker.CircuitPermit;
import fun.fengwk.rex.core.service.engine.ExtractedDocument;
import fun.fengwk.rex.core.service.gate.Decision;
import fun.fengwk.rex.core.service.gate.GateFeatureAnalyzer;
import fun.fengwk.rex.core.service.gate.GateFeatures;
import fun.fengwk.rex.core.service.gate.GateProperties;
import fun.fengwk.rex.core.service.gate.GateScorer;
import fun.fengwk.rex.core.service.headless.HeadlessBusyException;
import fun.fengwk.rex.core.service.headless.HeadlessRenderer;
import fun.fengwk.rex.core.service.pool.ExtractionInstancePool;
import fun.fengwk.rex.core.service.pool.ExtractionTimeoutException;
import fun.fengwk.rex.core.service.pool.InstanceCreationException;
import fun.fengwk.rex.core.service.pool.InstanceLease;
import fun.fengwk.rex.core.service.pool.PoolExhaustedException;
import fun.fengwk.rex.core.service.pool.PoolSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Retrying, escalating extraction over the gate, the per-mode circuit breakers, the engine
 * instance pool and the headless renderer.
 *
 * <p>Each call walks the modes from the gate decision towards {@link Decision#HEADLESS}. A mode is
 * retried with backoff up to its attempt budget; a refused breaker skips the mode without using
 * the budget. Callers only ever see a document or one {@link ExtractionException}.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ReliableExtractor {

    private final GateProperties gateProperties;
    private final ReliabilityProperties reliabilityProperties;
    private final GateFeatureAnalyzer gateFeatureAnalyzer;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final ExtractionInstancePool instancePool;
    private final HeadlessRenderer headlessRenderer;
    private final QualityEvaluator qualityEvaluator;
    private final Sleeper sleeper;
    private final Clock clock;
    private final RetryPolicy retryPolicy;

    private final AtomicLong requestIdGen = new AtomicLong(1);
    private final AtomicLong totalAttempts = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong totalRetries = new AtomicLong();
    private final AtomicLong completedCalls = new AtomicLong();
    private final AtomicLong circuitBreakerTrips = new AtomicLong();
    private final AtomicLong totalExtractions = new AtomicLong();
    private final AtomicLong escalations = new AtomicLong();
    private final AtomicLong degradedResults = new AtomicLong();

    public ReliableExtractor(
        GateProperties gateProperties,
        ReliabilityProperties reliabilityProperties,
        GateFeatureAnalyzer gateFeatureAnalyzer,
        CircuitBreakerRegistry circuitBreakerRegistry,
        ExtractionInstancePool instancePool,
        HeadlessRenderer headlessRenderer,
        QualityEvaluator qualityEvaluator,
        Sleeper sleeper,
        Clock clock
    ) {
        gateProperties.validate();
        reliabilityProperties.validate();
        this.gateProperties = gateProperties;
        this.reliabilityProperties = reliabilityProperties;
        this.gateFeatureAnalyzer = gateFeatureAnalyzer;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.instancePool = instancePool;
        this.headlessRenderer = headlessRenderer;
        this.qualityEvaluator = qualityEvaluator;
        this.sleeper = sleeper;
        this.clock = clock;
        this.retryPolicy = reliabilityProperties.toRetryPolicy();
    }

    public ExtractedDocument extractWithReliability(ExtractionRequest request) {
        return extractWithReliability(request, null, null);
    }

    /**
     * @param modeHint forces the initial mode, {@code null} lets the gate decide
     * @param deadline absolute deadline of the whole call, {@code null} applies the configured default
     * @throws ExtractionException when no document could be produced
     */
    public ExtractedDocument extractWithReliability(ExtractionRequest request, Decision modeHint, Instant deadline) {
        if (request == null || (!request.hasContent() && !request.hasUrl())) {
            throw new IllegalArgumentException("extraction request needs content or url");
        }
        Instant effectiveDeadline = deadline == null
            ? clock.instant().plusMillis(reliabilityProperties.getDefaultDeadlineMs())
            : deadline;
        Call call = new Call("rx-" + requestIdGen.getAndIncrement(), request, effectiveDeadline);
        totalExtractions.incrementAndGet();

        Decision initialMode = resolveInitialMode(call, modeHint);
        boolean allowEscalation = request.isAllowEscalation() && reliabilityProperties.isEscalationEnabled();
        log.debug(
            "reliable extraction started, requestId={}, url={}, initialMode={}, escalation={}",
            call.requestId,
            request.getUrl(),
            initialMode.getValue(),
            allowEscalation
        );

        try {
            Decision mode = initialMode;
            while (mode != null) {
                ExtractedDocument document = runMode(call, mode);
                if (document != null) {
                    return succeed(call, document, initialMode, mode);
                }
                failures.incrementAndGet();
                if (!allowEscalation) {
                    break;
                }
                Decision next = mode.next();
                if (next != null && !canServe(request, next)) {
                    log.info(
                        "headless rendering needs a url, stopping escalation, requestId={}, from={}",
                        call.requestId,
                        mode.getValue()
                    );
                    next = null;
                }
                if (next != null) {
                    escalations.incrementAndGet();
                    log.info(
                        "escalating extraction, requestId={}, from={}, to={}",
                        call.requestId,
                        mode.getValue(),
                        next.getValue()
                    );
                }
                mode = next;
            }
            return exhausted(call, allowEscalation);
        } catch (DeadlineExceeded ex) {
            if (call.lowQualityFallback != null && reliabilityProperties.isGracefulDegradation()) {
                return degrade(call);
            }
            throw terminal(call, ExtractionErrorKind.DEADLINE_EXCEEDED, "extraction deadline exceeded");
        }
    }

    public ReliabilityStats stats() {
        long completed = completedCalls.get();
        return ReliabilityStats.builder()
            .totalAttempts(totalAttempts.get())
            .successes(successes.get())
            .failures(failures.get())
            .avgRetries(completed == 0 ? 0D : totalRetries.get() / (double) completed)
            .circuitBreakerTrips(circuitBreakerTrips.get())
            .totalExtractions(totalExtractions.get())
            .escalations(escalations.get())
            .degradedResults(degradedResults.get())
            .build();
    }

    public Map<Decision, CircuitBreakerSnapshot> breakerSnapshots() {
        return circuitBreakerRegistry.snapshots();
    }

    public PoolSnapshot poolSnapshot() {
        return instancePool.snapshot();
    }

    private Decision resolveInitialMode(Call call, Decision modeHint) {
        ExtractionRequest request = call.request;
        if (!request.hasContent()) {
            return Decision.HEADLESS;
        }
        if (modeHint != null) {
            return servableMode(call, modeHint);
        }
        GateFeatures features = request.getFeatures() != null
            ? request.getFeatures()
            : gateFeatureAnalyzer.analyze(request.getContent(), request.getUrl());
        double score = GateScorer.score(features);
        Decision decision = GateScorer.decide(features, gateProperties.getHiThreshold(), gateProperties.getLoThreshold());
        log.debug("gate decided, requestId={}, score={}, decision={}", call.requestId, score, decision.getValue());
        return servableMode(call, decision);
    }

    private Decision servableMode(Call call, Decision mode) {
        if (canServe(call.request, mode)) {
            return mode;
        }
        log.info("headless rendering needs a url, falling back to probes, requestId={}", call.requestId);
        return Decision.PROBES_FIRST;
    }

    /**
     * Headless rendering navigates to the request url, content-only requests stay on the static modes.
     */
    private boolean canServe(ExtractionRequest request, Decision mode) {
        return mode != Decision.HEADLESS || request.hasUrl();
    }

    /**
     * @return the accepted document, or {@code null} when the mode is exhausted
     */
    private ExtractedDocument runMode(Call call, Decision mode) {
        CircuitBreaker breaker = circuitBreakerRegistry.get(mode);
        int maxAttempts = retryPolicy.maxAttempts(mode);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            checkDeadline(call);
            CircuitPermit permit;
            try {
                permit = breaker.tryAcquire();
            } catch (CircuitOpenException ex) {
                circuitBreakerTrips.incrementAndGet();
                call.lastError = ex;
                call.lastErrorCircuitOpen = true;
                log.info("circuit open, skipping mode, requestId={}, mode={}", call.requestId, mode.getValue());
                return null;
            }

            call.attempts++;
            totalAttempts.incrementAndGet();
            call.lastErrorCircuitOpen = false;
            try {
                ExtractedDocument document = executeAttempt(call, mode, breaker, permit);
                document.setQualityScore(qualityEvaluator.evaluate(document));
                if (mode == Decision.PROBES_FIRST && document.getQualityScore() < reliabilityProperties.getQualityThreshold()) {
                    log.info(
                        "probe result below quality threshold, requestId={}, quality={}, threshold={}",
                        call.requestId,
                        document.getQualityScore(),
                        reliabilityProperties.getQualityThreshold()
                    );
                    rememberFallback(call, document);
                    return null;
                }
                return document;
            } catch (DeadlineExceeded ex) {
                throw ex;
            } catch (RuntimeException ex) {
                call.lastError = ex;
                log.warn(
                    "extraction attempt failed, requestId={}, mode={}, attempt={}/{}, error={}",
                    call.requestId,
                    mode.getValue(),
                    attempt,
                    maxAttempts,
                    ex.getMessage()
                );
            }
            if (attempt < maxAttempts) {
                backoff(call, attempt);
            }
        }
        return null;
    }

    private ExtractedDocument executeAttempt(Call call, Decision mode, CircuitBreaker breaker, CircuitPermit permit) {
        if (!mode.usesInstancePool()) {
            Duration timeout = capToDeadline(call, Duration.ofMillis(reliabilityProperties.getHeadlessTimeoutMs()));
            try {
                ExtractedDocument document = headlessRenderer.render(call.request.getUrl(), timeout);
                breaker.onSuccess(permit);
                return document;
            } catch (HeadlessBusyException ex) {
                breaker.release(permit);
                throw ex;
            } catch (RuntimeException ex) {
                breaker.onFailure(permit);
                throw ex;
            }
        }

        InstanceLease lease;
        try {
            lease = instancePool.acquire(capToDeadline(call, instancePool.getConfig().getAcquireTimeout()));
        } catch (PoolExhaustedException ex) {
            // Backpressure, the backend itself was never touched.
            breaker.release(permit);
            throw ex;
        } catch (InstanceCreationException ex) {
            breaker.onFailure(permit);
            throw ex;
        } catch (RuntimeException ex) {
            breaker.release(permit);
            throw ex;
        }

        if (!clock.instant().isBefore(call.deadline)) {
            // Deadline passed while waiting for an instance, hand it back unused.
            lease.close();
            breaker.release(permit);
            throw new DeadlineExceeded();
        }

        boolean success = false;
        try {
            Duration epochTimeout = capToDeadline(call, instancePool.getConfig().getEpochTimeout());
            byte[] content = call.request.getContent();
            String url = call.request.getUrl();
            ExtractedDocument document = instancePool.runWithEpochTimeout(
                lease,
                epochTimeout,
                engine -> engine.extract(content, url, mode)
            );
            success = true;
            breaker.onSuccess(permit);
            return document;
        } catch (RuntimeException ex) {
            breaker.onFailure(permit);
            throw ex;
        } finally {
            lease.recordUsage(success);
            lease.close();
        }
    }

    private ExtractedDocument succeed(Call call, ExtractedDocument document, Decision initialMode, Decision finalMode) {
        document.setExtractionMode(finalMode.getValue());
        document.setDegraded(finalMode != initialMode);
        if (document.isDegraded()) {
            degradedResults.incrementAndGet();
        }
        successes.incrementAndGet();
        complete(call);
        log.info(
            "reliable extraction succeeded, requestId={}, mode={}, attempts={}, quality={}, degraded={}",
            call.requestId,
            finalMode.getValue(),
            call.attempts,
            document.getQualityScore(),
            document.isDegraded()
        );
        return document;
    }

    private ExtractedDocument exhausted(Call call, boolean allowEscalation) {
        if (call.lowQualityFallback != null && reliabilityProperties.isGracefulDegradation()) {
            return degrade(call);
        }
        if (!allowEscalation && call.lastErrorCircuitOpen) {
            throw terminal(call, ExtractionErrorKind.CIRCUIT_OPEN, "circuit open and escalation disabled");
        }
        if (call.lastError instanceof ExtractionTimeoutException) {
            throw terminal(call, ExtractionErrorKind.TIMEOUT, "final extraction attempt timed out");
        }
        throw terminal(call, ExtractionErrorKind.ALL_MODES_EXHAUSTED, "all extraction modes exhausted");
    }

    private ExtractedDocument degrade(Call call) {
        ExtractedDocument document = call.lowQualityFallback;
        document.setDegraded(true);
        degradedResults.incrementAndGet();
        successes.incrementAndGet();
        complete(call);
        log.info(
            "returning low quality fallback, requestId={}, quality={}, attempts={}",
            call.requestId,
            document.getQualityScore(),
            call.attempts
        );
        return document;
    }

    private ExtractionException terminal(Call call, ExtractionErrorKind kind, String message) {
        complete(call);
        log.warn(
            "reliable extraction failed, requestId={}, kind={}, attempts={}, lastError={}",
            call.requestId,
            kind,
            call.attempts,
            call.lastError == null ? "" : call.lastError.getMessage()
        );
        return new ExtractionException(kind, message + ", requestId=" + call.requestId, call.lastError, stats());
    }

    private void complete(Call call) {
        totalRetries.addAndGet(Math.max(0, call.attempts - 1));
        completedCalls.incrementAndGet();
    }

    private void rememberFallback(Call call, ExtractedDocument document) {
        if (call.lowQualityFallback == null || document.getQualityScore() > call.lowQualityFallback.getQualityScore()) {
            call.lowQualityFallback = document;
        }
    }

    private void backoff(Call call, int attempt) {
        Duration delay = capToDeadline(call, retryPolicy.backoff(attempt));
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("extraction backoff interrupted, requestId={}", call.requestId);
            throw new IllegalStateException("interrupted during extraction backoff", ex);
        }
    }

    private Duration capToDeadline(Call call, Duration duration) {
        Duration remaining = Duration.between(clock.instant(), call.deadline);
        if (remaining.isNegative()) {
            return Duration.ZERO;
        }
        return duration.compareTo(remaining) > 0 ? remaining : duration;
    }

    private void checkDeadline(Call call) {
        if (!clock.instant().isBefore(call.deadline)) {
            throw new DeadlineExceeded();
        }
    }

    /**
     * Per-call mutable state, confined to the calling thread.
     */
    private static class Call {

        private final String requestId;
        private final ExtractionRequest request;
        private final Instant deadline;
        private int attempts;
        private RuntimeException lastError;
        private boolean lastErrorCircuitOpen;
        private ExtractedDocument lowQualityFallback;

        private Call(String requestId, ExtractionRequest request, Instant deadline) {
            this.requestId = requestId;
            this.request = request;
            this.deadline = deadline;
        }

    }

    private static class DeadlineExceeded extends RuntimeException {

        private DeadlineExceeded() {
            super(null, null, false, false);
        }

    }

}
