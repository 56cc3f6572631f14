package com.scout.pipeline.ops.model;

/**
 * Exactly one target is expected; the first non-null one in field order is used.
 */
public record ReleaseRequest(
    Long jobId,
    String sourceId,
    String domain,
    Long intakeId
) {
}
