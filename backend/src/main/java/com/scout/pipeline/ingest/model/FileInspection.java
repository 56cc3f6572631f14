package com.scout.pipeline.ingest.model;

import java.util.List;

public record FileInspection(
    IntakeRecord record,
    long bronzeCount,
    long silverCount,
    List<IngestionHistoryEntry> history
) {
}
