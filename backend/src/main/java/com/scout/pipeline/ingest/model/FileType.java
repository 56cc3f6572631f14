package com.scout.pipeline.ingest.model;

import java.util.Locale;
import java.util.Optional;

public enum FileType {
    JSON,
    CSV,
    ZIP;

    /**
     * Detects the type from the file extension, falling back to the MIME type. Empty when neither
     * names a supported format.
     */
    public static Optional<FileType> detect(String fileName, String mimeType) {
        String lowerName = fileName == null ? "" : fileName.trim().toLowerCase(Locale.ROOT);
        if (lowerName.endsWith(".json") || lowerName.endsWith(".ndjson") || lowerName.endsWith(".jsonl")) {
            return Optional.of(JSON);
        }
        if (lowerName.endsWith(".csv")) {
            return Optional.of(CSV);
        }
        if (lowerName.endsWith(".zip")) {
            return Optional.of(ZIP);
        }
        String lowerMime = mimeType == null ? "" : mimeType.trim().toLowerCase(Locale.ROOT);
        if (lowerMime.contains("json")) {
            return Optional.of(JSON);
        }
        if (lowerMime.equals("text/csv") || lowerMime.equals("application/csv")) {
            return Optional.of(CSV);
        }
        if (lowerMime.contains("zip")) {
            return Optional.of(ZIP);
        }
        return Optional.empty();
    }

    public static FileType fromDb(String value) {
        return value == null ? null : FileType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
