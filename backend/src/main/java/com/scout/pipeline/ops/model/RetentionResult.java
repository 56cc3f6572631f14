package com.scout.pipeline.ops.model;

import java.time.Instant;

public record RetentionResult(
    int crawlJobsPurged,
    int historyRowsPurged,
    Instant cutoff
) {
}
