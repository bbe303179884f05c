package fun.fengwk.rex.core.service.engine;

import fun.fengwk.rex.core.service.gate.Decision;

/**
 * A sandboxed extraction context. Not thread-safe, an instance serves one call at a time.
 *
 * @author fengwk
 */
public interface ExtractionEngine extends AutoCloseable {

    String instanceId();

    /**
     * @throws EngineException when extraction fails, including {@link ResourceLimitExceededException}
     */
    ExtractedDocument extract(byte[] content, String url, Decision mode);

    /**
     * Asks a running extraction to stop. Safe to call from any thread. An interrupted engine is
     * not reused.
     */
    void interrupt();

    @Override
    void close();

}
