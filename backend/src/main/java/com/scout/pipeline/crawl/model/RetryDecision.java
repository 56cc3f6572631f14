package com.scout.pipeline.crawl.model;

import java.time.Instant;

public record RetryDecision(
    JobStatus status,
    int attempts,
    Instant nextEligibleAt
) {
    public boolean quarantined() {
        return status == JobStatus.BLOCKED;
    }
}
