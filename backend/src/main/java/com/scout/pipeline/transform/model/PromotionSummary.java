package com.scout.pipeline.transform.model;

public record PromotionSummary(
    int scanned,
    int inserted,
    int updated,
    int staleIgnored,
    int failed
) {
    public static PromotionSummary empty() {
        return new PromotionSummary(0, 0, 0, 0, 0);
    }

    public PromotionSummary plus(PromotionSummary other) {
        return new PromotionSummary(
            scanned + other.scanned,
            inserted + other.inserted,
            updated + other.updated,
            staleIgnored + other.staleIgnored,
            failed + other.failed
        );
    }
}
