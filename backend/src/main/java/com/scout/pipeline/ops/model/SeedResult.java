package com.scout.pipeline.ops.model;

import java.util.List;

public record SeedResult(
    String source,
    int requested,
    int created,
    int existing,
    List<String> rejected
) {
    public SeedResult {
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }
}
