package com.scout.pipeline.transform.model;

public enum UpsertOutcome {
    INSERTED,
    UPDATED,
    STALE_IGNORED
}
