package com.scout.pipeline.crawl.model;

public record CrawlDaemonStatus(
    boolean running,
    int activeWorkerCount,
    String workerId,
    long queueDepth,
    long runningJobs
) {
}
