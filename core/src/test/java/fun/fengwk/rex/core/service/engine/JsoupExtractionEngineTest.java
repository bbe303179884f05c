package fun.fengwk.rex.core.service.engine;

import fun.fengwk.rex.core.service.gate.Decision;
import fun.fengwk.rex.core.service.pool.ResourceLimiter;
import fun.fengwk.rex.core.service.pool.ResourceTracker;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class JsoupExtractionEngineTest {

    private static final byte[] HTML = "<html><body><article><p>Hello pooled world.</p></article></body></html>"
        .getBytes(StandardCharsets.UTF_8);

    private final MainContentExtractor mainContentExtractor = new MainContentExtractor(new MarkdownRenderer());

    @Test
    public void shouldExtractAndAccountWorkingMemory() {
        ResourceTracker tracker = new ResourceTracker("jsoup-1", 1024L * 1024L, ResourceLimiter.ALLOW_ALL);
        JsoupExtractionEngine engine = new JsoupExtractionEngine("jsoup-1", tracker, mainContentExtractor);

        ExtractedDocument document = engine.extract(HTML, "https://example.com", Decision.PROBES_FIRST);

        assertThat(document.getText()).isEqualTo("Hello pooled world.");
        assertThat(document.getExtractionMode()).isEqualTo("probes");
        assertThat(tracker.getCurrentMemoryBytes())
            .isEqualTo((long) HTML.length * JsoupExtractionEngine.WORKING_MEMORY_FACTOR);
    }

    @Test
    public void shouldFailWhenGrowthIsDenied() {
        ResourceTracker tracker = new ResourceTracker("jsoup-1", 16L, ResourceLimiter.ALLOW_ALL);
        JsoupExtractionEngine engine = new JsoupExtractionEngine("jsoup-1", tracker, mainContentExtractor);

        assertThatThrownBy(() -> engine.extract(HTML, "https://example.com", Decision.RAW))
            .isInstanceOf(ResourceLimitExceededException.class)
            .hasMessageContaining("jsoup-1");
        assertThat(tracker.getGrowFailures()).isEqualTo(1);
    }

    @Test
    public void shouldRefuseWorkWhenInterruptedOrClosed() {
        ResourceTracker tracker = new ResourceTracker("jsoup-1", 1024L * 1024L, ResourceLimiter.ALLOW_ALL);
        JsoupExtractionEngine interrupted = new JsoupExtractionEngine("jsoup-1", tracker, mainContentExtractor);
        JsoupExtractionEngine closed = new JsoupExtractionEngine("jsoup-2", tracker, mainContentExtractor);

        interrupted.interrupt();
        closed.close();

        assertThatThrownBy(() -> interrupted.extract(HTML, "https://example.com", Decision.RAW))
            .isInstanceOf(EngineException.class)
            .hasMessageContaining("interrupted");
        assertThatThrownBy(() -> closed.extract(HTML, "https://example.com", Decision.RAW))
            .isInstanceOf(EngineException.class)
            .hasMessageContaining("closed");
    }

    @Test
    public void shouldLoadOnlyJsoupEngines() {
        JsoupEngineLoader loader = new JsoupEngineLoader(mainContentExtractor);
        ResourceTracker tracker = new ResourceTracker("jsoup-7", 1024L, ResourceLimiter.ALLOW_ALL);

        assertThat(loader.load("jsoup", "jsoup-7", tracker).instanceId()).isEqualTo("jsoup-7");
        assertThatThrownBy(() -> loader.load("wasm", "wasm-1", tracker))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("wasm");
    }

}
