package com.scout.pipeline.ingest.model;

import com.scout.pipeline.crawl.model.JobStatus;

import java.time.Instant;

public record IntakeQueueStatus(
    JobStatus status,
    long fileCount,
    Instant oldestCreatedAt,
    Instant newestCreatedAt,
    double avgAttempts
) {
}
