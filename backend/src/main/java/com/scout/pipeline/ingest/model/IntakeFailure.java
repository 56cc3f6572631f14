package com.scout.pipeline.ingest.model;

import com.scout.pipeline.crawl.model.FailureKind;

import java.time.Instant;

public record IntakeFailure(
    Long failureId,
    String fileName,
    String bucket,
    String objectPath,
    Long sizeBytes,
    FailureKind errorKind,
    String errorMessage,
    int attempts,
    Instant failedAt
) {
}
