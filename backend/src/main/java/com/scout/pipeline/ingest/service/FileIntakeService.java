package com.scout.pipeline.ingest.service;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.model.FailureKind;
import com.scout.pipeline.crawl.model.JobStatus;
import com.scout.pipeline.crawl.service.UnknownTargetException;
import com.scout.pipeline.crawl.util.FailureClassifier;
import com.scout.pipeline.crawl.util.HashUtils;
import com.scout.pipeline.ingest.model.FileInspection;
import com.scout.pipeline.ingest.model.FileType;
import com.scout.pipeline.ingest.model.IntakeFailure;
import com.scout.pipeline.ingest.model.IntakeRecord;
import com.scout.pipeline.ingest.model.IntakeStats;
import com.scout.pipeline.ingest.model.ObjectCreatedEvent;
import com.scout.pipeline.ingest.model.SourceKind;
import com.scout.pipeline.ingest.model.StoredObject;
import com.scout.pipeline.ingest.model.SubmitOutcome;
import com.scout.pipeline.ingest.model.SubmitRequest;
import com.scout.pipeline.ingest.model.SubmitResult;
import com.scout.pipeline.ingest.persistence.IntakeRepository;
import com.scout.pipeline.ingest.storage.ObjectStore;
import com.scout.pipeline.transform.persistence.BronzeRepository;
import com.scout.pipeline.transform.persistence.SilverRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Validates and enqueues delivered files. Oversized and unsupported files are rejected before they
 * reach the queue and go straight to the failure sink.
 */
@Service
public class FileIntakeService {
    private static final Logger log = LoggerFactory.getLogger(FileIntakeService.class);
    private static final String UPLOAD_PREFIX = "uploads/";
    private static final Duration STATS_WINDOW = Duration.ofHours(24);

    private final IntakeRepository intakeRepository;
    private final ObjectStore objectStore;
    private final BronzeRepository bronzeRepository;
    private final SilverRepository silverRepository;
    private final PipelineProperties properties;
    private final Clock clock;

    public FileIntakeService(
        IntakeRepository intakeRepository,
        ObjectStore objectStore,
        BronzeRepository bronzeRepository,
        SilverRepository silverRepository,
        PipelineProperties properties,
        Clock clock
    ) {
        this.intakeRepository = intakeRepository;
        this.objectStore = objectStore;
        this.bronzeRepository = bronzeRepository;
        this.silverRepository = silverRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public SubmitResult submit(SubmitRequest request) {
        String fileName = requireFileName(request.fileName());
        byte[] content = request.content() == null ? new byte[0] : request.content();
        long size = Math.max(request.sizeBytes(), content.length);
        String bucket = properties.getIntake().getBucket();
        if (exceedsLimit(size)) {
            return rejectOversized(fileName, bucket, null, size);
        }
        Optional<FileType> type = FileType.detect(fileName, request.mimeType());
        if (type.isEmpty()) {
            return rejectUnsupported(fileName, bucket, null, size);
        }

        String checksum = HashUtils.sha256Hex(content);
        SourceKind sourceKind = request.sourceKind() == null ? SourceKind.UPLOAD : request.sourceKind();
        int priority = priorityFor(sourceKind);
        Optional<SubmitResult> deduplicated = deduplicate(checksum, priority);
        if (deduplicated.isPresent()) {
            return deduplicated.get();
        }

        String path = UPLOAD_PREFIX + checksum + "/" + safeName(fileName);
        StoredObject stored;
        try {
            stored = objectStore.putObject(bucket, path, content, request.mimeType());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store upload " + fileName, e);
        }
        return enqueue(fileName, type.get(), size, checksum, sourceKind, stored, request.mimeType(), priority);
    }

    /**
     * Submits each file on its own. A file without a name is rejected in place so the rest of the
     * batch still goes through.
     */
    public List<SubmitResult> submitBatch(List<SubmitRequest> requests) {
        List<SubmitResult> results = new ArrayList<>(requests.size());
        for (SubmitRequest request : requests) {
            if (request == null || request.fileName() == null || request.fileName().isBlank()) {
                results.add(SubmitResult.rejected(FailureKind.PERMANENT, "fileName is required"));
                continue;
            }
            results.add(submit(request));
        }
        long queued = results.stream().filter(result -> result.outcome() == SubmitOutcome.QUEUED).count();
        log.info("Batch intake of {} files: {} queued", requests.size(), queued);
        return results;
    }

    /**
     * Trigger intake for objects announced by the store. Objects outside the watched bucket and
     * prefixes are ignored.
     */
    public SubmitResult onObjectCreated(ObjectCreatedEvent event) {
        if (event == null || event.bucket() == null || event.path() == null) {
            return SubmitResult.ignored("incomplete event");
        }
        if (!isWatched(event.bucket(), event.path())) {
            log.debug("Ignoring object {}/{} outside watched prefixes", event.bucket(), event.path());
            return SubmitResult.ignored("not a watched bucket/prefix");
        }
        String fileName = fileNameOf(event.path());
        if (exceedsLimit(event.sizeBytes())) {
            return rejectOversized(fileName, event.bucket(), event.path(), event.sizeBytes());
        }
        Optional<FileType> type = FileType.detect(fileName, event.mimeType());
        if (type.isEmpty()) {
            return rejectUnsupported(fileName, event.bucket(), event.path(), event.sizeBytes());
        }

        String checksum;
        try (InputStream stream = objectStore.openObject(event.bucket(), event.path())) {
            checksum = HashUtils.sha256Hex(stream);
        } catch (NoSuchFileException e) {
            return reject(fileName, event.bucket(), event.path(), event.sizeBytes(), FailureKind.PERMANENT,
                "object not found: " + event.bucket() + "/" + event.path());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read object " + event.bucket() + "/" + event.path(), e);
        }

        int priority = priorityFor(SourceKind.TRIGGER);
        Optional<SubmitResult> deduplicated = deduplicate(checksum, priority);
        if (deduplicated.isPresent()) {
            return deduplicated.get();
        }
        StoredObject stored = new StoredObject(event.bucket(), event.path(), event.sizeBytes(), event.mimeType());
        return enqueue(fileName, type.get(), event.sizeBytes(), checksum, SourceKind.TRIGGER, stored, event.mimeType(), priority);
    }

    public int retryFailed(String fileName) {
        int reset = intakeRepository.retryFailed(fileName, clock.instant());
        log.info("Reset {} failed intake records{}", reset, fileName == null ? "" : " for " + fileName);
        return reset;
    }

    public IntakeStats stats() {
        Instant now = clock.instant();
        Instant windowStart = now.minus(STATS_WINDOW);
        return new IntakeStats(
            intakeRepository.queueStatus(),
            intakeRepository.performanceSince(windowStart),
            windowStart,
            now
        );
    }

    public List<IntakeFailure> listFailures(int limit) {
        return intakeRepository.listFailures(limit);
    }

    public FileInspection inspectFile(long intakeId) {
        IntakeRecord record = intakeRepository.findById(intakeId)
            .orElseThrow(() -> new UnknownTargetException("Unknown intake record " + intakeId));
        String sourceFile = record.contentRef();
        return new FileInspection(
            record,
            bronzeRepository.countBySourceFilePrefix(sourceFile),
            silverRepository.countBySourceFilePrefix(sourceFile),
            intakeRepository.listHistory(intakeId)
        );
    }

    boolean isWatched(String bucket, String path) {
        if (!properties.getIntake().getBucket().equals(bucket)) {
            return false;
        }
        for (String prefix : properties.getIntake().getAcceptedPrefixes()) {
            if (prefix != null && !prefix.isBlank() && path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private Optional<SubmitResult> deduplicate(String checksum, int priority) {
        Optional<IntakeRecord> existing = intakeRepository.findByChecksum(checksum);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        IntakeRecord record = existing.get();
        JobStatus status = record.status();
        if (status == JobStatus.DONE) {
            return Optional.of(new SubmitResult(SubmitOutcome.ALREADY_PROCESSED, record.intakeId(), checksum,
                "content already processed"));
        }
        if (status == JobStatus.FAILED || status == JobStatus.BLOCKED) {
            if (intakeRepository.requeue(record.intakeId(), Math.min(priority, record.priority()), clock.instant())) {
                log.info("Resubmission requeued intake {} ({})", record.intakeId(), record.fileName());
                return Optional.of(new SubmitResult(SubmitOutcome.REQUEUED, record.intakeId(), checksum,
                    "previous " + status.name().toLowerCase(Locale.ROOT) + " submission requeued"));
            }
        }
        return Optional.of(new SubmitResult(SubmitOutcome.DUPLICATE, record.intakeId(), checksum,
            "identical content already queued"));
    }

    private SubmitResult enqueue(
        String fileName,
        FileType type,
        long size,
        String checksum,
        SourceKind sourceKind,
        StoredObject stored,
        String mimeType,
        int priority
    ) {
        Long intakeId = intakeRepository.insert(
            fileName,
            type,
            size,
            checksum,
            sourceKind,
            stored.bucket(),
            stored.path(),
            stored.contentRef(),
            mimeType,
            priority,
            clock.instant()
        );
        if (intakeId == null) {
            Long racedId = intakeRepository.findByChecksum(checksum).map(IntakeRecord::intakeId).orElse(null);
            return new SubmitResult(SubmitOutcome.DUPLICATE, racedId, checksum, "identical content already queued");
        }
        log.info("Queued intake {} {} type={} size={} kind={} priority={}", intakeId, fileName, type, size, sourceKind, priority);
        return new SubmitResult(SubmitOutcome.QUEUED, intakeId, checksum, null);
    }

    private SubmitResult rejectOversized(String fileName, String bucket, String path, long size) {
        String message = "file size " + size + " exceeds limit " + properties.getIntake().getMaxFileBytes();
        return reject(fileName, bucket, path, size, FailureKind.SIZE_LIMIT, message);
    }

    private SubmitResult rejectUnsupported(String fileName, String bucket, String path, long size) {
        return reject(fileName, bucket, path, size, FailureKind.PERMANENT, "unsupported file type: " + fileName);
    }

    private SubmitResult reject(String fileName, String bucket, String path, long size, FailureKind kind, String message) {
        intakeRepository.insertFailure(new IntakeFailure(
            null,
            fileName,
            bucket,
            path,
            size,
            kind,
            FailureClassifier.truncate(message),
            0,
            clock.instant()
        ));
        log.warn("Rejected {} ({}): {}", fileName, kind, message);
        return SubmitResult.rejected(kind, message);
    }

    private boolean exceedsLimit(long size) {
        return size > properties.getIntake().getMaxFileBytes();
    }

    private int priorityFor(SourceKind sourceKind) {
        return sourceKind == SourceKind.UPLOAD
            ? properties.getIntake().getManualPriority()
            : properties.getIntake().getTriggerPriority();
    }

    private static String requireFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName is required");
        }
        return fileName.trim();
    }

    private static String fileNameOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    private static String safeName(String fileName) {
        String name = fileNameOf(fileName.replace('\\', '/'));
        return name.isBlank() ? "upload" : name;
    }
}
