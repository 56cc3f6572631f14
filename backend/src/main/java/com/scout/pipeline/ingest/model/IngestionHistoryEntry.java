package com.scout.pipeline.ingest.model;

import com.scout.pipeline.crawl.model.JobStatus;

import java.time.Instant;

public record IngestionHistoryEntry(
    Long historyId,
    Long intakeId,
    String fileName,
    FileType fileType,
    SourceKind sourceKind,
    JobStatus status,
    int attempts,
    int recordsProcessed,
    int recordsFailed,
    long elapsedMs,
    String errorDetail,
    Instant processedAt
) {
}
