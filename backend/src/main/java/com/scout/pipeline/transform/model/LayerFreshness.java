package com.scout.pipeline.transform.model;

import java.time.Instant;

/**
 * Latest write per layer. A null timestamp means the layer has never been written.
 */
public record LayerFreshness(
    Instant bronzeIngestedAt,
    Instant silverUpdatedAt,
    Instant watermarkProcessedAt,
    Instant goldRefreshedAt
) {
}
