package com.scout.pipeline.crawl.service;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.model.FailureKind;
import com.scout.pipeline.crawl.model.JobStatus;
import com.scout.pipeline.crawl.model.RetryDecision;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Exponential backoff with a capped number of doublings. Drives both crawl jobs and file intake.
 */
@Component
public class RetryPolicy {
    private final PipelineProperties properties;

    public RetryPolicy(PipelineProperties properties) {
        this.properties = properties;
    }

    public Duration delayFor(int attempts) {
        int doublings = Math.min(Math.max(0, attempts), properties.getRetry().getMaxDoublings());
        long base = properties.getRetry().getBaseDelaySeconds();
        return Duration.ofSeconds(base * (1L << doublings));
    }

    public RetryDecision decide(int previousAttempts, FailureKind kind, Instant now) {
        int safePrevious = Math.max(0, previousAttempts);
        if (kind == FailureKind.PERMANENT || kind == FailureKind.SIZE_LIMIT) {
            return new RetryDecision(JobStatus.FAILED, safePrevious, now);
        }
        int attempts = safePrevious + 1;
        if (attempts >= properties.getRetry().getQuarantineThreshold()) {
            return new RetryDecision(JobStatus.BLOCKED, attempts, now);
        }
        return new RetryDecision(JobStatus.QUEUED, attempts, now.plus(delayFor(attempts)));
    }
}
