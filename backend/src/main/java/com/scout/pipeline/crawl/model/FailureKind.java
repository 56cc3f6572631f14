package com.scout.pipeline.crawl.model;

/**
 * Failure taxonomy shared by crawl jobs and file intake.
 * Only {@link #TRANSIENT} consumes retry budget; the remaining kinds are either terminal or benign.
 */
public enum FailureKind {
    TRANSIENT,
    PERMANENT,
    SIZE_LIMIT,
    DUPLICATE,
    LEASE_CONFLICT,
    STALE_LEASE
}
