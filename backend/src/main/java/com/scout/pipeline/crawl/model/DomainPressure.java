package com.scout.pipeline.crawl.model;

import java.time.Instant;

public record DomainPressure(
    String domain,
    long queued,
    long running,
    long failed,
    long blocked,
    Instant nextDueAt,
    int inFlight,
    long minSpacingMs
) {
}
