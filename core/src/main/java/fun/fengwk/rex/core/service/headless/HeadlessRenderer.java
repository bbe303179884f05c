package fun.fengwk.rex.core.service.headless;

import fun.fengwk.rex.core.service.engine.ExtractedDocument;

import java.time.Duration;

/**
 * Renders a page in a real browser and extracts the rendered content.
 *
 * @author fengwk
 */
public interface HeadlessRenderer {

    /**
     * @throws HeadlessBusyException when the render queue has no room
     * @throws HeadlessRenderException when the page cannot be rendered
     * @throws fun.fengwk.rex.core.service.pool.ExtractionTimeoutException when rendering exceeds
     * {@code timeout}
     */
    ExtractedDocument render(String url, Duration timeout);

}
