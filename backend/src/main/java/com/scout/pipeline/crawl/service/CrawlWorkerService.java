package com.scout.pipeline.crawl.service;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.fetch.FetchExecutor;
import com.scout.pipeline.crawl.model.CrawlDaemonStatus;
import com.scout.pipeline.crawl.model.CrawlJob;
import com.scout.pipeline.crawl.model.FailureKind;
import com.scout.pipeline.crawl.model.FetchOutcome;
import com.scout.pipeline.crawl.model.FetchRequest;
import com.scout.pipeline.crawl.model.JobStatus;
import com.scout.pipeline.crawl.model.PageCacheEntry;
import com.scout.pipeline.crawl.persistence.CrawlJobRepository;
import com.scout.pipeline.crawl.util.FailureClassifier;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pool of crawl workers, each running claim, fetch, record, report. Workers share nothing in memory;
 * all coordination goes through the job table.
 */
@Service
public class CrawlWorkerService {
    private static final Logger log = LoggerFactory.getLogger(CrawlWorkerService.class);

    private final CrawlQueueService queueService;
    private final CrawlResultService resultService;
    private final CrawlJobRepository jobRepository;
    private final FetchExecutor fetchExecutor;
    private final PipelineProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final String instanceId;

    private ExecutorService executor;
    private int activeWorkerCount;

    public CrawlWorkerService(
        CrawlQueueService queueService,
        CrawlResultService resultService,
        CrawlJobRepository jobRepository,
        FetchExecutor fetchExecutor,
        PipelineProperties properties
    ) {
        this.queueService = queueService;
        this.resultService = resultService;
        this.jobRepository = jobRepository;
        this.fetchExecutor = fetchExecutor;
        this.properties = properties;
        this.instanceId = properties.getWorkerId() != null
            ? properties.getWorkerId()
            : "crawl-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getDaemon().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public CrawlDaemonStatus getStatus() {
        long queued = 0;
        long runningJobs = 0;
        try {
            queued = jobRepository.countByStatus(JobStatus.QUEUED);
            runningJobs = jobRepository.countByStatus(JobStatus.RUNNING);
        } catch (Exception e) {
            log.warn("Failed to load crawl queue counts", e);
        }
        return new CrawlDaemonStatus(running.get(), activeWorkerCount, instanceId, queued, runningJobs);
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int workerCount = properties.getDaemon().getWorkerCount();
            int pollIntervalMs = properties.getDaemon().getPollIntervalMs();
            activeWorkerCount = workerCount;
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("crawl-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                executor.submit(() -> workerLoop(workerIndex, pollIntervalMs));
            }
            log.info("Started {} crawl workers as {}", workerCount, instanceId);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            activeWorkerCount = 0;
            log.info("Stopped crawl workers");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Runs one claim/process/report cycle. Returns false when nothing was eligible.
     */
    public boolean processNext(String workerId) {
        Optional<CrawlJob> claimed = queueService.claimNext(workerId);
        if (claimed.isEmpty()) {
            return false;
        }
        CrawlJob job = claimed.get();
        FetchOutcome outcome;
        try {
            PageCacheEntry prior = resultService.findPrior(job.sourceKey(), job.resource()).orElse(null);
            outcome = fetchExecutor.fetch(new FetchRequest(job.sourceKey(), job.resource(), prior));
        } catch (Exception e) {
            reportFailure(job, workerId, e);
            return true;
        }

        try {
            int children = resultService.recordResult(job, outcome);
            queueService.complete(job.jobId(), workerId);
            log.debug("Job {} done status={} parse={} children={}", job.jobId(), outcome.httpStatus(), outcome.parseStatus(), children);
        } catch (Exception e) {
            log.warn("Failed to record result for job {} ({})", job.jobId(), job.resource(), e);
            try {
                queueService.fail(job.jobId(), workerId, FailureKind.TRANSIENT, FailureClassifier.describe(e));
            } catch (Exception recordError) {
                log.warn("Could not mark job {} failed; leaving it for the stale-lease sweep", job.jobId(), recordError);
            }
        }
        return true;
    }

    String workerIdFor(int workerIndex) {
        return instanceId + "-" + workerIndex;
    }

    private void reportFailure(CrawlJob job, String workerId, Exception error) {
        FailureKind kind = FailureClassifier.classify(error);
        String description = FailureClassifier.describe(error);
        log.warn("Fetch failed for job {} ({}): kind={} {}", job.jobId(), job.resource(), kind, description);
        try {
            resultService.recordFailure(job, FailureClassifier.httpStatusOf(error), description);
            queueService.fail(job.jobId(), workerId, kind, description);
        } catch (Exception recordError) {
            log.warn("Could not record failure for job {}; leaving it for the stale-lease sweep", job.jobId(), recordError);
        }
    }

    private void workerLoop(int workerIndex, int pollIntervalMs) {
        String workerId = workerIdFor(workerIndex);
        Thread.currentThread().setName("crawl-worker-" + workerIndex);
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            boolean worked;
            try {
                worked = processNext(workerId);
            } catch (Exception e) {
                log.warn("Crawl worker {} failed to claim a job", workerIndex, e);
                worked = false;
            }
            if (!worked) {
                sleep(pollIntervalMs);
            }
        }
    }

    private void sleep(int pollIntervalMs) {
        try {
            TimeUnit.MILLISECONDS.sleep(Math.max(100, pollIntervalMs));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
