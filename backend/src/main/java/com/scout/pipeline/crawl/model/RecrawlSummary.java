package com.scout.pipeline.crawl.model;

public record RecrawlSummary(
    int scanned,
    int requeued,
    int enqueued,
    int pulledEarlier,
    int untouched
) {
}
