package com.scout.pipeline.crawl.model;

import java.time.Instant;

public record ResourceInspection(
    Long jobId,
    String sourceKey,
    String resource,
    JobStatus status,
    int attempts,
    String lastError,
    Instant nextEligibleAt,
    Instant lastFetchAt,
    Integer httpStatus,
    ParseStatus parseStatus,
    String parseNote,
    long downstreamRecordCount
) {
}
