package com.scout.pipeline.ingest.model;

import java.time.Instant;
import java.util.List;

public record IntakeStats(
    List<IntakeQueueStatus> queue,
    List<IngestionPerformance> performance,
    Instant windowStart,
    Instant generatedAt
) {
}
