package fun.fengwk.rex.core.service.headless;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.rex.core.service.engine.ExtractedDocument;
import fun.fengwk.rex.core.service.engine.MainContentExtractor;
import fun.fengwk.rex.core.service.gate.Decision;
import fun.fengwk.rex.core.service.pool.ExtractionTimeoutException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Headless renderer backed by a blocking request queue and browser worker threads, each worker
 * owning one Chromium session.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class PlaywrightHeadlessRenderer implements HeadlessRenderer {

    private final HeadlessProperties headlessProperties;
    private final MainContentExtractor mainContentExtractor;
    private final BrowserSessionFactory browserSessionFactory;
    private final BlockingQueue<RenderTask> queue;
    private final List<Thread> workerThreads = new CopyOnWriteArrayList<>();
    private final AtomicInteger workerIdGen = new AtomicInteger(1);
    private final AtomicInteger workerCount = new AtomicInteger(0);
    private final AtomicInteger idleWorkers = new AtomicInteger(0);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    @Autowired
    public PlaywrightHeadlessRenderer(HeadlessProperties headlessProperties, MainContentExtractor mainContentExtractor) {
        this(headlessProperties, mainContentExtractor, defaultBrowserSessionFactory(headlessProperties));
    }

    PlaywrightHeadlessRenderer(
        HeadlessProperties headlessProperties,
        MainContentExtractor mainContentExtractor,
        BrowserSessionFactory browserSessionFactory
    ) {
        this.headlessProperties = headlessProperties;
        this.mainContentExtractor = mainContentExtractor;
        this.browserSessionFactory = browserSessionFactory;
        this.queue = new LinkedBlockingQueue<>(Math.max(1, headlessProperties.getRequestQueueCapacity()));
        startMinWorkers();
    }

    @Override
    public ExtractedDocument render(String url, Duration timeout) {
        if (url == null || url.isBlank()) {
            throw new HeadlessRenderException("headless render requires a url");
        }
        if (shutdown.get()) {
            throw new HeadlessRenderException("headless renderer is shutdown");
        }
        RenderTask task = new RenderTask(url);
        long timeoutMs = timeout == null ? headlessProperties.getNavigationTimeoutMs() : Math.max(0L, timeout.toMillis());
        try {
            boolean offered = queue.offer(task, headlessProperties.getQueueOfferTimeoutMs(), TimeUnit.MILLISECONDS);
            if (!offered) {
                log.warn("render queue full, size={}, capacity={}", queue.size(), headlessProperties.getRequestQueueCapacity());
                throw new HeadlessBusyException("headless renderer is busy");
            }
            ensureWorkerCapacity();
            return task.future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            task.cancelled.set(true);
            queue.remove(task);
            log.warn("render timeout, url={}, timeoutMs={}", url, timeoutMs);
            throw new ExtractionTimeoutException("headless render of " + url + " exceeded " + timeoutMs + "ms");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            task.cancelled.set(true);
            log.warn("render interrupted, url={}", url);
            throw new IllegalStateException("headless render interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof HeadlessRenderException headlessRenderException) {
                throw headlessRenderException;
            }
            throw new HeadlessRenderException("headless render failed: " + cause.getMessage(), cause);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        List<RenderTask> pending = new ArrayList<>();
        queue.drainTo(pending);
        for (RenderTask task : pending) {
            task.future.completeExceptionally(new HeadlessRenderException("headless renderer is shutting down"));
        }
        for (Thread thread : workerThreads) {
            thread.interrupt();
        }
    }

    int getWorkerCount() {
        return workerCount.get();
    }

    int getQueueSize() {
        return queue.size();
    }

    private void startMinWorkers() {
        for (int i = 0; i < normalizeMinWorkerSize(); i++) {
            spawnWorker();
        }
    }

    private void ensureWorkerCapacity() {
        if (shutdown.get() || idleWorkers.get() > 0) {
            return;
        }
        int maxSize = normalizeMaxWorkerSize();
        while (workerCount.get() < maxSize && idleWorkers.get() == 0 && !queue.isEmpty()) {
            spawnWorker();
        }
    }

    private void spawnWorker() {
        int current = workerCount.get();
        if (current >= normalizeMaxWorkerSize()) {
            return;
        }
        if (!workerCount.compareAndSet(current, current + 1)) {
            return;
        }
        Thread thread = new Thread(new Worker(workerIdGen.getAndIncrement()));
        thread.setName("rex-headless-worker-" + thread.getId());
        thread.setDaemon(true);
        workerThreads.add(thread);
        thread.start();
    }

    private int normalizeMinWorkerSize() {
        return Math.max(headlessProperties.getWorkerPoolMinSize(), 0);
    }

    private int normalizeMaxWorkerSize() {
        return Math.max(headlessProperties.getWorkerPoolMaxSize(), Math.max(1, normalizeMinWorkerSize()));
    }

    private boolean shouldTerminate(long lastTaskAt) {
        long idleTtlMs = headlessProperties.getWorkerIdleTtlMs();
        if (idleTtlMs <= 0 || System.currentTimeMillis() - lastTaskAt < idleTtlMs) {
            return false;
        }
        return workerCount.get() > normalizeMinWorkerSize();
    }

    private static class RenderTask {

        private final String url;
        private final CompletableFuture<ExtractedDocument> future = new CompletableFuture<>();
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private RenderTask(String url) {
            this.url = url;
        }

    }

    private class Worker implements Runnable {

        private final int workerId;
        private long lastTaskAt = System.currentTimeMillis();
        private BrowserSession browserSession;

        private Worker(int workerId) {
            this.workerId = workerId;
        }

        @Override
        public void run() {
            try {
                loop();
            } catch (RuntimeException ex) {
                log.warn("headless worker terminated unexpectedly, id={}", workerId, ex);
            } finally {
                closeSession();
                workerCount.decrementAndGet();
                workerThreads.remove(Thread.currentThread());
            }
        }

        private void loop() {
            long refreshIntervalMs = Math.max(1L, headlessProperties.getWorkerRefreshIntervalMs());
            while (!shutdown.get()) {
                RenderTask task;
                idleWorkers.incrementAndGet();
                try {
                    task = queue.poll(refreshIntervalMs, TimeUnit.MILLISECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return;
                } finally {
                    idleWorkers.decrementAndGet();
                }
                if (task == null) {
                    if (shouldTerminate(lastTaskAt)) {
                        return;
                    }
                    continue;
                }
                lastTaskAt = System.currentTimeMillis();
                if (task.cancelled.get()) {
                    continue;
                }
                renderTask(task);
            }
        }

        private void renderTask(RenderTask task) {
            try {
                if (browserSession == null) {
                    browserSession = browserSessionFactory.create();
                }
                String html = browserSession.renderHtml(
                    task.url,
                    headlessProperties.getNavigationTimeoutMs(),
                    headlessProperties.getSettleDelayMs()
                );
                ExtractedDocument document = mainContentExtractor.extract(html, task.url);
                document.setExtractionMode(Decision.HEADLESS.getValue());
                task.future.complete(document);
            } catch (RuntimeException ex) {
                log.warn("headless render failed, id={}, url={}, error={}", workerId, task.url, ex.getMessage());
                task.future.completeExceptionally(ex);
                // A broken browser is replaced on the next task.
                closeSession();
            }
        }

        private void closeSession() {
            if (browserSession == null) {
                return;
            }
            try {
                browserSession.close();
            } catch (RuntimeException ex) {
                log.debug("failed to close browser session, id={}, error={}", workerId, ex.getMessage());
            } finally {
                browserSession = null;
            }
        }

    }

    private static BrowserSessionFactory defaultBrowserSessionFactory(HeadlessProperties headlessProperties) {
        return () -> {
            Playwright playwright = Playwright.create();
            try {
                BrowserType.LaunchOptions options = new BrowserType.LaunchOptions().setHeadless(true);
                if (headlessProperties.getLaunchArgs() != null && !headlessProperties.getLaunchArgs().isEmpty()) {
                    options.setArgs(headlessProperties.getLaunchArgs());
                }
                if (headlessProperties.getBrowserChannel() != null && !headlessProperties.getBrowserChannel().isBlank()) {
                    options.setChannel(headlessProperties.getBrowserChannel());
                }
                if (headlessProperties.getExecutablePath() != null && !headlessProperties.getExecutablePath().isBlank()) {
                    options.setExecutablePath(Paths.get(headlessProperties.getExecutablePath()));
                }
                Browser browser = playwright.chromium().launch(options);
                return new PlaywrightBrowserSession(playwright, browser, headlessProperties);
            } catch (RuntimeException ex) {
                playwright.close();
                throw ex;
            }
        };
    }

    interface BrowserSessionFactory {

        BrowserSession create();

    }

    interface BrowserSession extends AutoCloseable {

        String renderHtml(String url, long navigationTimeoutMs, long settleDelayMs);

        @Override
        void close();

    }

    static class PlaywrightBrowserSession implements BrowserSession {

        private final Playwright playwright;
        private final Browser browser;
        private final HeadlessProperties headlessProperties;

        PlaywrightBrowserSession(Playwright playwright, Browser browser, HeadlessProperties headlessProperties) {
            this.playwright = playwright;
            this.browser = browser;
            this.headlessProperties = headlessProperties;
        }

        @Override
        public String renderHtml(String url, long navigationTimeoutMs, long settleDelayMs) {
            Browser.NewContextOptions contextOptions = new Browser.NewContextOptions();
            if (headlessProperties.getUserAgent() != null && !headlessProperties.getUserAgent().isBlank()) {
                contextOptions.setUserAgent(headlessProperties.getUserAgent());
            }
            if (headlessProperties.getLocale() != null && !headlessProperties.getLocale().isBlank()) {
                contextOptions.setLocale(headlessProperties.getLocale());
            }
            try (BrowserContext context = browser.newContext(contextOptions)) {
                Page page = context.newPage();
                page.navigate(url, new Page.NavigateOptions()
                    .setTimeout(navigationTimeoutMs)
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
                if (settleDelayMs > 0) {
                    page.waitForTimeout(settleDelayMs);
                }
                return page.content();
            }
        }

        @Override
        public void close() {
            try {
                browser.close();
            } finally {
                playwright.close();
            }
        }

    }

}
