package com.scout.pipeline.ops.model;

public record ReleaseResult(
    String target,
    int released,
    boolean sourceUnquarantined
) {
}
