package com.scout.pipeline.crawl.model;

import java.util.List;

public record FetchOutcome(
    int httpStatus,
    String etag,
    String lastModified,
    String contentSha256,
    ParseStatus parseStatus,
    String parseNote,
    List<String> discovered
) {
    public FetchOutcome {
        discovered = discovered == null ? List.of() : List.copyOf(discovered);
    }
}
