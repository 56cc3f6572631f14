package com.scout.pipeline.crawl.fetch;

import com.scout.pipeline.crawl.model.FetchOutcome;
import com.scout.pipeline.crawl.model.FetchRequest;

/**
 * External fetch/parse step. Implementations signal failures with
 * {@link com.scout.pipeline.crawl.service.TransientProcessingException} or
 * {@link com.scout.pipeline.crawl.service.PermanentProcessingException}; the worker classifies
 * anything else as transient.
 */
public interface FetchExecutor {
    FetchOutcome fetch(FetchRequest request);
}
