package fun.fengwk.rex.core.service.pool;

/**
 * No instance became available within the wait budget. Retryable.
 *
 * @author fengwk
 */
public class PoolExhaustedException extends PoolException {

    public PoolExhaustedException(String message) {
        super(message);
    }

}
