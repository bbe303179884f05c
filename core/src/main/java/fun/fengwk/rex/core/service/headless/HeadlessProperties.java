package fun.fengwk.rex.core.service.headless;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Headless browser renderer configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "rex.headless")
public class HeadlessProperties {

    /**
     * Browser workers kept alive when idle, 0 launches browsers on demand only.
     */
    private int workerPoolMinSize = 0;

    private int workerPoolMaxSize = 2;

    /**
     * Render requests waiting for a worker.
     */
    private int requestQueueCapacity = 16;

    /**
     * Timeout when the request queue is full.
     */
    private long queueOfferTimeoutMs = 1000;

    /**
     * Idle time after which workers above the minimum exit, 0 keeps them forever.
     */
    private long workerIdleTtlMs = 60000;

    /**
     * Queue polling interval of idle workers.
     */
    private long workerRefreshIntervalMs = 1000;

    private long navigationTimeoutMs = 30000;

    /**
     * Wait after DOMContentLoaded so client side rendering can finish.
     */
    private long settleDelayMs = 500;

    private List<String> launchArgs = new ArrayList<>();

    private String browserChannel = "";

    private String executablePath = "";

    private String userAgent = "";

    private String locale = "";

}
