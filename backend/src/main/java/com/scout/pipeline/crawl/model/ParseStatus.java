package com.scout.pipeline.crawl.model;

import java.util.Locale;

public enum ParseStatus {
    OK,
    NOT_MODIFIED,
    SKIPPED,
    ERROR;

    public boolean isSuccess() {
        return this == OK || this == NOT_MODIFIED;
    }

    public static ParseStatus fromDb(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ParseStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return ERROR;
        }
    }
}
