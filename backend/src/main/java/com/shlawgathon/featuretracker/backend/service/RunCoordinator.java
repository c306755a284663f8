package com.shlawgathon.featuretracker.backend.service;

import com.shlawgathon.featuretracker.backend.dto.RunResponse;
import com.shlawgathon.featuretracker.backend.dto.StatusResponse;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs monitor and tagging batches on a single background worker, one batch at a time.
 */
@Service
public class RunCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RunCoordinator.class);

    public static final String TASK_CRAWL = "crawl";
    public static final String TASK_TAGGING = "tagging";

    private final MonitorService monitorService;
    private final FeatureTaggingService featureTaggingService;
    private final WorkspaceLock workspaceLock;

    private final ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "tracker-batch");
        thread.setDaemon(true);
        return thread;
    });

    private final AtomicReference<String> runningTask = new AtomicReference<>();
    private volatile Instant lastCrawlStarted;
    private volatile Instant lastTaggingStarted;

    public RunCoordinator(MonitorService monitorService,
            FeatureTaggingService featureTaggingService,
            WorkspaceLock workspaceLock) {
        this.monitorService = monitorService;
        this.featureTaggingService = featureTaggingService;
        this.workspaceLock = workspaceLock;
    }

    /**
     * Starts a monitor run over one product, or over every configured product when {@code productName} is empty.
     */
    public RunResponse triggerCrawl(String productName) {
        boolean single = productName != null && !productName.isBlank();
        if (single) {
            monitorService.requireProduct(productName);
        }
        return submit(TASK_CRAWL, () -> {
            lastCrawlStarted = Instant.now();
            workspaceLock.runExclusive(() -> single
                    ? List.of(monitorService.monitorProduct(productName))
                    : monitorService.monitorAll());
        });
    }

    /**
     * Starts a tagging run over the pending features of one product, or of every product.
     */
    public RunResponse triggerTagging(String productName, int limit) {
        boolean single = productName != null && !productName.isBlank();
        return submit(TASK_TAGGING, () -> {
            lastTaggingStarted = Instant.now();
            workspaceLock.runExclusive(() -> single
                    ? List.of(featureTaggingService.tagPending(productName, limit))
                    : featureTaggingService.tagAll(limit));
        });
    }

    public StatusResponse status() {
        String task = runningTask.get();
        return StatusResponse.builder()
                .crawlRunning(TASK_CRAWL.equals(task))
                .taggingRunning(TASK_TAGGING.equals(task))
                .lastCrawlStarted(lastCrawlStarted)
                .lastTaggingStarted(lastTaggingStarted)
                .products(monitorService.syncStatuses())
                .recentUpdates(monitorService.recentUpdates())
                .build();
    }

    public boolean isRunning() {
        return runningTask.get() != null;
    }

    private RunResponse submit(String task, Runnable work) {
        if (!runningTask.compareAndSet(null, task)) {
            log.info("[RUN] {} requested while {} is running", task, runningTask.get());
            return RunResponse.builder().status(RunResponse.ALREADY_RUNNING).task(runningTask.get()).build();
        }

        executor.submit(() -> {
            long started = System.currentTimeMillis();
            log.info("[RUN START] {}", task);
            try {
                work.run();
                log.info("[RUN END] {} finished in {}ms", task, System.currentTimeMillis() - started);
            } catch (RuntimeException e) {
                log.error("[RUN ERROR] {} failed: {}", task, e.getMessage(), e);
            } finally {
                runningTask.set(null);
            }
        });
        return RunResponse.builder().status(RunResponse.STARTED).task(task).build();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
