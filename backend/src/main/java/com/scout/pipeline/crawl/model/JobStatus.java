package com.scout.pipeline.crawl.model;

import java.util.Locale;

public enum JobStatus {
    QUEUED,
    RUNNING,
    DONE,
    FAILED,
    BLOCKED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == BLOCKED;
    }

    public static JobStatus fromDb(String value) {
        return value == null ? null : JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
