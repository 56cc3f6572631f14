package com.scout.pipeline.ops.model;

import java.time.Instant;

public record EmergencyStopResult(
    int crawlJobsRequeued,
    int intakeRecordsRequeued,
    int domainsThrottled,
    long spacingMs,
    Instant stoppedAt
) {
}
