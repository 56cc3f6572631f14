package com.scout.pipeline.transform.model;

import java.time.Instant;

public record AggregateRefresh(
    String aggregateName,
    long rowsWritten,
    long durationMs,
    String lockOwner,
    Instant refreshedAt
) {
}
