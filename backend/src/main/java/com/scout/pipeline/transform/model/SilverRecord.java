package com.scout.pipeline.transform.model;

import java.math.BigDecimal;
import java.time.Instant;

public record SilverRecord(
    String naturalKey,
    String keySource,
    String sourceFile,
    long rawEventId,
    Instant eventTime,
    String storeKey,
    BigDecimal amount,
    String payload,
    Instant loadedAt,
    Instant updatedAt
) {
}
