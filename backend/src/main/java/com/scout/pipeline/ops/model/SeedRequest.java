package com.scout.pipeline.ops.model;

import java.util.List;

public record SeedRequest(
    String source,
    List<String> urls,
    Integer priority
) {
}
