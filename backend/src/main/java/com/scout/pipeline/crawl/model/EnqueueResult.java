package com.scout.pipeline.crawl.model;

public record EnqueueResult(
    Long jobId,
    boolean created,
    JobStatus status
) {
}
