package fun.fengwk.rex.core.service.reliability;

import java.time.Duration;

/**
 * @author fengwk
 */
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

}
