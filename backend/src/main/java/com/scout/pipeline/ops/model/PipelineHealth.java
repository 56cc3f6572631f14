package com.scout.pipeline.ops.model;

import java.time.Instant;

public record PipelineHealth(
    long queueDepth,
    long running,
    long failedLast24h,
    long pagesProcessedLast24h,
    long quarantined,
    long blockedJobs,
    long intakeQueued,
    long intakeFailuresLast24h,
    Instant generatedAt
) {
}
