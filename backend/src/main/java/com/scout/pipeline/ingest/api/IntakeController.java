package com.scout.pipeline.ingest.api;

import com.scout.pipeline.crawl.model.FailureKind;
import com.scout.pipeline.ingest.model.FileInspection;
import com.scout.pipeline.ingest.model.IntakeFailure;
import com.scout.pipeline.ingest.model.IntakeStats;
import com.scout.pipeline.ingest.model.ObjectCreatedEvent;
import com.scout.pipeline.ingest.model.SourceKind;
import com.scout.pipeline.ingest.model.StoredObject;
import com.scout.pipeline.ingest.model.SubmitOutcome;
import com.scout.pipeline.ingest.model.SubmitRequest;
import com.scout.pipeline.ingest.model.SubmitResult;
import com.scout.pipeline.ingest.service.FileIntakeService;
import com.scout.pipeline.ingest.storage.ObjectStore;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/intake")
public class IntakeController {
    private final FileIntakeService intakeService;
    private final ObjectStore objectStore;

    public IntakeController(FileIntakeService intakeService, ObjectStore objectStore) {
        this.intakeService = intakeService;
        this.objectStore = objectStore;
    }

    @PostMapping("/files")
    public ResponseEntity<SubmitResult> upload(@RequestPart("file") MultipartFile file) {
        SubmitResult result = intakeService.submit(toRequest(file));
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    /**
     * One result per part, in upload order. Per-file rejections do not fail the request.
     */
    @PostMapping("/files/batch")
    public List<SubmitResult> uploadBatch(@RequestPart("files") List<MultipartFile> files) {
        return intakeService.submitBatch(files.stream().map(IntakeController::toRequest).toList());
    }

    @GetMapping("/stats")
    public IntakeStats stats() {
        return intakeService.stats();
    }

    /**
     * Writes an object into the store. The store announces it, which runs trigger intake.
     */
    @PutMapping("/objects")
    public StoredObject putObject(
        @RequestParam(name = "bucket") String bucket,
        @RequestParam(name = "path") String path,
        @RequestHeader(name = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
        @RequestBody byte[] content
    ) throws IOException {
        return objectStore.putObject(bucket, path, content, contentType);
    }

    @PostMapping("/events/object-created")
    public ResponseEntity<SubmitResult> objectCreated(@RequestBody ObjectCreatedEvent event) {
        SubmitResult result = intakeService.onObjectCreated(event);
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    @GetMapping("/failures")
    public List<IntakeFailure> failures(@RequestParam(name = "limit", required = false, defaultValue = "50") int limit) {
        return intakeService.listFailures(Math.max(1, Math.min(500, limit)));
    }

    @GetMapping("/files/{intakeId}")
    public FileInspection inspect(@PathVariable("intakeId") long intakeId) {
        return intakeService.inspectFile(intakeId);
    }

    @PostMapping("/retry-failed")
    public Map<String, Object> retryFailed(@RequestParam(name = "fileName", required = false) String fileName) {
        return Map.of("reset", intakeService.retryFailed(fileName));
    }

    private static SubmitRequest toRequest(MultipartFile file) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read upload " + file.getOriginalFilename(), e);
        }
        return new SubmitRequest(
            file.getOriginalFilename(),
            file.getSize(),
            content,
            SourceKind.UPLOAD,
            file.getContentType()
        );
    }

    private static HttpStatus statusFor(SubmitResult result) {
        if (result.outcome() != SubmitOutcome.REJECTED) {
            return result.outcome() == SubmitOutcome.QUEUED || result.outcome() == SubmitOutcome.REQUEUED
                ? HttpStatus.ACCEPTED
                : HttpStatus.OK;
        }
        return result.rejectionKind() == FailureKind.SIZE_LIMIT
            ? HttpStatus.PAYLOAD_TOO_LARGE
            : HttpStatus.UNPROCESSABLE_ENTITY;
    }
}
