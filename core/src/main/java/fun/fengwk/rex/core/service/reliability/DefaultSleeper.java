package fun.fengwk.rex.core.service.reliability;

import java.time.Duration;

/**
 * @author fengwk
 */
public final class DefaultSleeper implements Sleeper {

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        long ms = duration == null ? 0L : Math.max(0L, duration.toMillis());
        if (ms > 0) {
            Thread.sleep(ms);
        }
    }

}
