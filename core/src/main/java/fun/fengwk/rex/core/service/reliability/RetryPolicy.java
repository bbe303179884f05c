package fun.fengwk.rex.core.service.reliability;

import fun.fengwk.rex.core.service.gate.Decision;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Per-mode attempt budget with exponential backoff between attempts of the same mode.
 *
 * @author fengwk
 */
@Value
public class RetryPolicy {

    int rawMaxAttempts;
    int probesMaxAttempts;
    int headlessMaxAttempts;
    Duration initialBackoff;
    Duration maxBackoff;
    double backoffMultiplier;
    boolean jitter;

    @Builder(toBuilder = true)
    public RetryPolicy(
        int rawMaxAttempts,
        int probesMaxAttempts,
        int headlessMaxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        double backoffMultiplier,
        boolean jitter
    ) {
        if (rawMaxAttempts < 1 || probesMaxAttempts < 1 || headlessMaxAttempts < 1) {
            throw new IllegalArgumentException("max attempts per mode must be positive");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative: " + initialBackoff);
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must not be below initialBackoff: " + maxBackoff);
        }
        if (backoffMultiplier < 1D) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1: " + backoffMultiplier);
        }
        this.rawMaxAttempts = rawMaxAttempts;
        this.probesMaxAttempts = probesMaxAttempts;
        this.headlessMaxAttempts = headlessMaxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.backoffMultiplier = backoffMultiplier;
        this.jitter = jitter;
    }

    public int maxAttempts(Decision mode) {
        switch (mode) {
            case RAW:
                return rawMaxAttempts;
            case PROBES_FIRST:
                return probesMaxAttempts;
            default:
                return headlessMaxAttempts;
        }
    }

    /**
     * Delay before retry number {@code retry} (1-based) of the same mode.
     */
    public Duration backoff(int retry) {
        double delayMs = initialBackoff.toMillis() * Math.pow(backoffMultiplier, Math.max(0, retry - 1));
        long cappedMs = (long) Math.min(delayMs, maxBackoff.toMillis());
        if (jitter && cappedMs > 0) {
            // Full jitter over the upper half keeps retries of concurrent calls apart.
            cappedMs = cappedMs / 2 + ThreadLocalRandom.current().nextLong(cappedMs / 2 + 1);
        }
        return Duration.ofMillis(cappedMs);
    }

}
