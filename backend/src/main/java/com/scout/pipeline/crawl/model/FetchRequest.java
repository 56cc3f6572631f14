package com.scout.pipeline.crawl.model;

/**
 * Input to the fetch executor: the locator plus whatever the cache remembers about it.
 * {@code prior} is null on a first fetch.
 */
public record FetchRequest(
    String sourceKey,
    String resource,
    PageCacheEntry prior
) {
}
