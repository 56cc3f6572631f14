package com.scout.pipeline.crawl.model;

import java.time.Instant;

public record DomainState(
    String domain,
    int inFlight,
    Instant lastFetchAt,
    long minSpacingMs,
    Instant updatedAt
) {
    public Instant nextAdmissibleAt() {
        return lastFetchAt == null ? null : lastFetchAt.plusMillis(minSpacingMs);
    }
}
