package com.scout.pipeline.ops.model;

public record QuarantineResult(
    String sourceId,
    String reason,
    int jobsBlocked
) {
}
