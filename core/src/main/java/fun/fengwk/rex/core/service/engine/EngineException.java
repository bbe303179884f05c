package fun.fengwk.rex.core.service.engine;

/**
 * Failure of an extraction engine call.
 *
 * @author fengwk
 */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }

}
