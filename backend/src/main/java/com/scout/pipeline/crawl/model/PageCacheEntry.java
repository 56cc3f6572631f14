package com.scout.pipeline.crawl.model;

import java.time.Instant;

public record PageCacheEntry(
    String sourceKey,
    String resource,
    Integer httpStatus,
    String etag,
    String lastModified,
    String contentSha256,
    Instant fetchedAt,
    ParseStatus parseStatus,
    String parseNote
) {
}
