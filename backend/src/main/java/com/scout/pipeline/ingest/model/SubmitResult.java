package com.scout.pipeline.ingest.model;

import com.scout.pipeline.crawl.model.FailureKind;

public record SubmitResult(
    SubmitOutcome outcome,
    Long intakeId,
    String checksum,
    String message,
    FailureKind rejectionKind
) {
    public SubmitResult(SubmitOutcome outcome, Long intakeId, String checksum, String message) {
        this(outcome, intakeId, checksum, message, null);
    }

    public static SubmitResult ignored(String message) {
        return new SubmitResult(SubmitOutcome.IGNORED, null, null, message);
    }

    public static SubmitResult rejected(FailureKind kind, String message) {
        return new SubmitResult(SubmitOutcome.REJECTED, null, null, message, kind);
    }
}
