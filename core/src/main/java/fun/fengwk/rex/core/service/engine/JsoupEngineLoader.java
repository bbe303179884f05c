package fun.fengwk.rex.core.service.engine;

import fun.fengwk.rex.core.service.pool.EngineLoader;
import fun.fengwk.rex.core.service.pool.ResourceTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Loads {@link JsoupExtractionEngine} instances.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class JsoupEngineLoader implements EngineLoader {

    public static final String ENGINE_ID = "jsoup";

    private final MainContentExtractor mainContentExtractor;

    @Override
    public ExtractionEngine load(String engineId, String instanceId, ResourceTracker resourceTracker) {
        if (!ENGINE_ID.equalsIgnoreCase(engineId)) {
            throw new IllegalArgumentException("unsupported engine: " + engineId);
        }
        return new JsoupExtractionEngine(instanceId, resourceTracker, mainContentExtractor);
    }

}
