package com.scout.pipeline.transform.model;

public record LayerCounts(
    long bronze,
    long silver,
    long goldDaily,
    long goldSourceFiles,
    long watermarksOk,
    long watermarksFailed,
    LayerFreshness freshness
) {
}
