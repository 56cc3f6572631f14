package com.scout.pipeline.ingest.model;

/**
 * Published by the object store after a write; the only input to trigger-driven intake.
 */
public record ObjectCreatedEvent(
    String bucket,
    String path,
    long sizeBytes,
    String mimeType
) {
}
