package fun.fengwk.rex.core.service.headless;

/**
 * @author fengwk
 */
public class HeadlessRenderException extends RuntimeException {

    public HeadlessRenderException(String message) {
        super(message);
    }

    public HeadlessRenderException(String message, Throwable cause) {
        super(message, cause);
    }

}
