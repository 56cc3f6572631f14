package com.scout.pipeline.crawl.model;

public enum RecrawlOutcome {
    REQUEUED,
    ENQUEUED,
    PULLED_EARLIER,
    UNTOUCHED
}
