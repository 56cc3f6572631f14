package com.scout.pipeline.transform.model;

import java.time.Instant;

public record RawEvent(
    long eventId,
    String objectKey,
    String sourceFile,
    String entryName,
    String txnId,
    String payload,
    Instant ingestedAt
) {
}
