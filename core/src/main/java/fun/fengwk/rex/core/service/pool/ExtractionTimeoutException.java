package fun.fengwk.rex.core.service.pool;

/**
 * An extraction ran past its wall-clock deadline. Pooled instances involved are retired.
 *
 * @author fengwk
 */
public class ExtractionTimeoutException extends RuntimeException {

    public ExtractionTimeoutException(String message) {
        super(message);
    }

}
