package fun.fengwk.rex.core.service.headless;

/**
 * Render request refused because the render queue stayed full; no browser was involved.
 *
 * @author fengwk
 */
public class HeadlessBusyException extends HeadlessRenderException {

    public HeadlessBusyException(String message) {
        super(message);
    }

}
