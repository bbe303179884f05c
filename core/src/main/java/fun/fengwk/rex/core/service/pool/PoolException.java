package fun.fengwk.rex.core.service.pool;

/**
 * @author fengwk
 */
public class PoolException extends RuntimeException {

    public PoolException(String message) {
        super(message);
    }

    public PoolException(String message, Throwable cause) {
        super(message, cause);
    }

}
