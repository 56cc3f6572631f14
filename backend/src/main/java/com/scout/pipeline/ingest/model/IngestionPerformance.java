package com.scout.pipeline.ingest.model;

/**
 * Processing outcomes of one source kind over a window of ingestion history. Quarantined files
 * count as failed.
 */
public record IngestionPerformance(
    SourceKind sourceKind,
    long filesProcessed,
    long successful,
    long failed,
    long recordsProcessed,
    long recordsFailed,
    double avgElapsedMs
) {
}
