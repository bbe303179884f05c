package fun.fengwk.rex.core.service.engine;

import fun.fengwk.rex.core.service.gate.Decision;
import fun.fengwk.rex.core.service.pool.ResourceTracker;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Static html extraction on jsoup, sized against its {@link ResourceTracker}.
 *
 * @author fengwk
 */
@Slf4j
public class JsoupExtractionEngine implements ExtractionEngine {

    /**
     * Parsed DOM plus rendered output, relative to the raw content size.
     */
    static final int WORKING_MEMORY_FACTOR = 4;

    private final String instanceId;
    private final ResourceTracker resourceTracker;
    private final MainContentExtractor mainContentExtractor;
    private final AtomicBoolean interrupted = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public JsoupExtractionEngine(String instanceId, ResourceTracker resourceTracker, MainContentExtractor mainContentExtractor) {
        this.instanceId = instanceId;
        this.resourceTracker = resourceTracker;
        this.mainContentExtractor = mainContentExtractor;
    }

    @Override
    public String instanceId() {
        return instanceId;
    }

    @Override
    public ExtractedDocument extract(byte[] content, String url, Decision mode) {
        checkRunnable();
        byte[] safeContent = content == null ? new byte[0] : content;
        long desiredBytes = (long) safeContent.length * WORKING_MEMORY_FACTOR;
        if (!resourceTracker.requestGrowth(desiredBytes)) {
            throw new ResourceLimitExceededException(instanceId, desiredBytes, resourceTracker.getMemoryLimitBytes());
        }

        Document document = mainContentExtractor.parse(new String(safeContent, StandardCharsets.UTF_8), url);
        checkRunnable();
        ExtractedDocument extracted = mainContentExtractor.extract(document, url);
        checkRunnable();

        extracted.setExtractionMode(mode == null ? Decision.RAW.getValue() : mode.getValue());
        log.debug(
            "extracted document, instance={}, url={}, mode={}, words={}",
            instanceId,
            url,
            extracted.getExtractionMode(),
            extracted.getWordCount()
        );
        return extracted;
    }

    @Override
    public void interrupt() {
        interrupted.set(true);
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public boolean isInterrupted() {
        return interrupted.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void checkRunnable() {
        if (closed.get()) {
            throw new EngineException("engine instance " + instanceId + " is closed");
        }
        if (interrupted.get() || Thread.currentThread().isInterrupted()) {
            throw new EngineException("engine instance " + instanceId + " was interrupted");
        }
    }

}
