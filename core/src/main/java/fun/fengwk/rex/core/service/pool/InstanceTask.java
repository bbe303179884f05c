package fun.fengwk.rex.core.service.pool;

import fun.fengwk.rex.core.service.engine.ExtractionEngine;

/**
 * @author fengwk
 */
@FunctionalInterface
public interface InstanceTask<T> {

    T run(ExtractionEngine engine);

}
