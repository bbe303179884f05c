package fun.fengwk.rex.core.service.pool;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * @author fengwk
 */
public class FakeEngineLoader implements EngineLoader {

    private final List<FakeExtractionEngine> engines = new CopyOnWriteArrayList<>();

    volatile RuntimeException failure;

    @Override
    public FakeExtractionEngine load(String engineId, String instanceId, ResourceTracker resourceTracker) {
        if (failure != null) {
            throw failure;
        }
        FakeExtractionEngine engine = new FakeExtractionEngine(instanceId, resourceTracker);
        engines.add(engine);
        return engine;
    }

    public List<FakeExtractionEngine> getEngines() {
        return engines;
    }

    public FakeExtractionEngine engine(String instanceId) {
        return engines.stream()
            .filter(engine -> engine.instanceId().equals(instanceId))
            .findFirst()
            .orElseThrow();
    }

}
