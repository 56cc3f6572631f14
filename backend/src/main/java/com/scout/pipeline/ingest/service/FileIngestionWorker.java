package com.scout.pipeline.ingest.service;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.model.FailureKind;
import com.scout.pipeline.crawl.model.JobStatus;
import com.scout.pipeline.crawl.model.RetryDecision;
import com.scout.pipeline.crawl.service.PermanentProcessingException;
import com.scout.pipeline.crawl.service.RetryPolicy;
import com.scout.pipeline.crawl.util.FailureClassifier;
import com.scout.pipeline.ingest.handler.FileFormatHandler;
import com.scout.pipeline.ingest.handler.RawEventSink;
import com.scout.pipeline.ingest.model.FileType;
import com.scout.pipeline.ingest.model.HandlerResult;
import com.scout.pipeline.ingest.model.IngestionHistoryEntry;
import com.scout.pipeline.ingest.model.IntakeFailure;
import com.scout.pipeline.ingest.model.IntakeRecord;
import com.scout.pipeline.ingest.persistence.IntakeRepository;
import com.scout.pipeline.ingest.storage.ObjectStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.lang.management.ManagementFactory;
import java.nio.file.NoSuchFileException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class FileIngestionWorker {
    private static final Logger log = LoggerFactory.getLogger(FileIngestionWorker.class);

    private final IntakeRepository intakeRepository;
    private final ObjectStore objectStore;
    private final RawEventSink rawEventSink;
    private final RetryPolicy retryPolicy;
    private final PipelineProperties properties;
    private final Clock clock;
    private final Map<FileType, FileFormatHandler> handlers = new EnumMap<>(FileType.class);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final String instanceId;

    private ExecutorService executor;

    public FileIngestionWorker(
        IntakeRepository intakeRepository,
        ObjectStore objectStore,
        RawEventSink rawEventSink,
        RetryPolicy retryPolicy,
        List<FileFormatHandler> formatHandlers,
        PipelineProperties properties,
        Clock clock
    ) {
        this.intakeRepository = intakeRepository;
        this.objectStore = objectStore;
        this.rawEventSink = rawEventSink;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
        this.clock = clock;
        for (FileFormatHandler handler : formatHandlers) {
            handlers.put(handler.type(), handler);
        }
        this.instanceId = properties.getWorkerId() != null
            ? properties.getWorkerId() + "-intake"
            : "intake-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getIntake().isWorkerEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int workerCount = properties.getIntake().getWorkerCount();
            int pollIntervalMs = properties.getIntake().getPollIntervalMs();
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("intake-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                executor.submit(() -> workerLoop(workerIndex, pollIntervalMs));
            }
            log.info("Started {} intake workers as {}", workerCount, instanceId);
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
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<IntakeRecord> claimNext(String workerId) {
        Instant now = clock.instant();
        List<IntakeRecord> candidates = intakeRepository.findClaimCandidates(now, properties.getQueue().getClaimScanLimit());
        for (IntakeRecord candidate : candidates) {
            if (intakeRepository.tryClaim(candidate.intakeId(), workerId, now)) {
                return intakeRepository.findById(candidate.intakeId());
            }
            log.debug("Lease conflict on intake {}; another worker claimed it first", candidate.intakeId());
        }
        return Optional.empty();
    }

    /**
     * Claims one intake record and runs its format handler. Returns false when the queue is empty.
     */
    public boolean processNext(String workerId) {
        Optional<IntakeRecord> claimed = claimNext(workerId);
        if (claimed.isEmpty()) {
            return false;
        }
        IntakeRecord record = claimed.get();
        long startedNanos = System.nanoTime();
        HandlerResult result;
        try {
            result = runHandler(record);
        } catch (Exception e) {
            long elapsedMs = Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
            recordFailure(record, workerId, e, elapsedMs);
            return true;
        }
        long elapsedMs = Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
        Instant now = clock.instant();
        try {
            if (!intakeRepository.markDone(record.intakeId(), workerId, result.recordsProcessed(),
                FailureClassifier.truncate(result.errorDetail()), now)) {
                log.warn("Stale lease: intake {} is no longer held by {}", record.intakeId(), workerId);
                return true;
            }
            intakeRepository.insertHistory(historyEntry(record, JobStatus.DONE, record.attempts(), result, elapsedMs, now));
            log.info("Ingested intake {} {} records={} failed={} in {}ms",
                record.intakeId(), record.fileName(), result.recordsProcessed(), result.recordsFailed(), elapsedMs);
        } catch (Exception e) {
            log.warn("Could not record completion of intake {}; leaving it for the stale-lease sweep", record.intakeId(), e);
        }
        return true;
    }

    private HandlerResult runHandler(IntakeRecord record) throws IOException {
        FileFormatHandler handler = handlers.get(record.fileType());
        if (handler == null) {
            throw new PermanentProcessingException("no handler for file type " + record.fileType());
        }
        try (InputStream content = objectStore.openObject(record.bucket(), record.objectPath())) {
            return handler.handle(record.contentRef(), content, rawEventSink);
        } catch (NoSuchFileException e) {
            throw new PermanentProcessingException("object missing: " + record.contentRef(), e);
        }
    }

    private void recordFailure(IntakeRecord record, String workerId, Exception error, long elapsedMs) {
        FailureKind kind = FailureClassifier.classify(error);
        String description = FailureClassifier.describe(error);
        Instant now = clock.instant();
        RetryDecision decision = retryPolicy.decide(record.attempts(), kind, now);
        log.warn("Intake {} {} failed: kind={} next={} {}", record.intakeId(), record.fileName(), kind, decision.status(), description);
        try {
            if (!intakeRepository.applyFailure(record.intakeId(), workerId, decision, description, now)) {
                log.warn("Stale lease: intake {} changed hands before its failure could be recorded", record.intakeId());
                return;
            }
            HandlerResult empty = new HandlerResult(0, 0, description);
            intakeRepository.insertHistory(historyEntry(record, decision.status(), decision.attempts(), empty, elapsedMs, now));
            if (decision.status() == JobStatus.FAILED || decision.quarantined()) {
                intakeRepository.insertFailure(new IntakeFailure(
                    null,
                    record.fileName(),
                    record.bucket(),
                    record.objectPath(),
                    record.sizeBytes(),
                    kind,
                    description,
                    decision.attempts(),
                    now
                ));
            }
        } catch (Exception recordError) {
            log.warn("Could not record failure for intake {}; leaving it for the stale-lease sweep", record.intakeId(), recordError);
        }
    }

    private IngestionHistoryEntry historyEntry(
        IntakeRecord record,
        JobStatus status,
        int attempts,
        HandlerResult result,
        long elapsedMs,
        Instant now
    ) {
        return new IngestionHistoryEntry(
            null,
            record.intakeId(),
            record.fileName(),
            record.fileType(),
            record.sourceKind(),
            status,
            attempts,
            result.recordsProcessed(),
            result.recordsFailed(),
            elapsedMs,
            FailureClassifier.truncate(result.errorDetail()),
            now
        );
    }

    private void workerLoop(int workerIndex, int pollIntervalMs) {
        String workerId = instanceId + "-" + workerIndex;
        Thread.currentThread().setName("intake-worker-" + workerIndex);
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            boolean worked;
            try {
                worked = processNext(workerId);
            } catch (Exception e) {
                log.warn("Intake worker {} failed to claim a record", workerIndex, e);
                worked = false;
            }
            if (!worked) {
                try {
                    TimeUnit.MILLISECONDS.sleep(Math.max(100, pollIntervalMs));
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }
}
