package fun.fengwk.rex.core.service.pool;

/**
 * @author fengwk
 */
public class InstanceCreationException extends PoolException {

    public InstanceCreationException(String message, Throwable cause) {
        super(message, cause);
    }

}
