package com.scout.pipeline.ingest.model;

public enum SubmitOutcome {
    QUEUED,
    REQUEUED,
    DUPLICATE,
    ALREADY_PROCESSED,
    REJECTED,
    IGNORED
}
