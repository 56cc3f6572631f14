package com.scout.pipeline.ingest.model;

/**
 * An interactive upload. {@code sizeBytes} is the declared size; the larger of it and the actual
 * content length is checked against the cap.
 */
public record SubmitRequest(
    String fileName,
    long sizeBytes,
    byte[] content,
    SourceKind sourceKind,
    String mimeType
) {
}
