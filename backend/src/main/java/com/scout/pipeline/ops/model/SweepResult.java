package com.scout.pipeline.ops.model;

public record SweepResult(
    int crawlScanned,
    int crawlRequeued,
    int intakeScanned,
    int intakeRequeued
) {
}
