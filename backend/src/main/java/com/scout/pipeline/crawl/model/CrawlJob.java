package com.scout.pipeline.crawl.model;

import java.time.Instant;

public record CrawlJob(
    long jobId,
    String sourceKey,
    String domain,
    String resource,
    int depth,
    int priority,
    JobStatus status,
    int attempts,
    Instant nextEligibleAt,
    String leaseOwner,
    Instant leaseAt,
    String parentResource,
    String note,
    String lastError,
    Instant createdAt,
    Instant updatedAt,
    Instant finishedAt
) {
}
