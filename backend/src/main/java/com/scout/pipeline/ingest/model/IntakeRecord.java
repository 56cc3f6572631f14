package com.scout.pipeline.ingest.model;

import com.scout.pipeline.crawl.model.JobStatus;

import java.time.Instant;

public record IntakeRecord(
    long intakeId,
    String fileName,
    FileType fileType,
    long sizeBytes,
    String checksum,
    SourceKind sourceKind,
    String bucket,
    String objectPath,
    String contentRef,
    String mimeType,
    int priority,
    JobStatus status,
    int attempts,
    Instant nextEligibleAt,
    String leaseOwner,
    Instant leaseAt,
    String errorMessage,
    int recordsProcessed,
    Instant createdAt,
    Instant updatedAt,
    Instant finishedAt
) {
}
