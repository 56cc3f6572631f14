package com.scout.pipeline.transform.model;

import java.util.List;

public record RefreshSummary(
    boolean acquired,
    String owner,
    List<AggregateRefresh> refreshes
) {
    public RefreshSummary {
        refreshes = refreshes == null ? List.of() : List.copyOf(refreshes);
    }

    public static RefreshSummary skipped(String owner) {
        return new RefreshSummary(false, owner, List.of());
    }
}
