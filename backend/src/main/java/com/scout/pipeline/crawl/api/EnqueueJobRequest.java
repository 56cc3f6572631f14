package com.scout.pipeline.crawl.api;

public record EnqueueJobRequest(
    String source,
    String resource,
    Integer priority,
    String parentResource,
    Integer depth
) {
}
