package fun.fengwk.rex.core.service.pool;

import fun.fengwk.rex.core.service.engine.ExtractionEngine;

/**
 * Builds fresh engine instances for the pool.
 *
 * @author fengwk
 */
public interface EngineLoader {

    /**
     * @param engineId which engine implementation to load
     * @param instanceId unique id of the new instance
     * @param resourceTracker tracker the engine must consult before growing its memory
     * @throws RuntimeException when the engine cannot be initialized
     */
    ExtractionEngine load(String engineId, String instanceId, ResourceTracker resourceTracker);

}
