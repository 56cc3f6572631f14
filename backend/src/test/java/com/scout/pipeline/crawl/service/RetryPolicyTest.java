package com.scout.pipeline.crawl.service;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.model.FailureKind;
import com.scout.pipeline.crawl.model.JobStatus;
import com.scout.pipeline.crawl.model.RetryDecision;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final PipelineProperties properties = new PipelineProperties();
    private final RetryPolicy policy = new RetryPolicy(properties);

    @Test
    void backoffDoublesUntilTheCap() {
        assertThat(policy.delayFor(0)).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(120));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(480));
        assertThat(policy.delayFor(6)).isEqualTo(Duration.ofSeconds(60L * 64));
        assertThat(policy.delayFor(40)).isEqualTo(policy.delayFor(6));
    }

    @Test
    void backoffIsMonotonicInAttempts() {
        Duration previous = Duration.ZERO;
        for (int attempts = 0; attempts < 12; attempts++) {
            Duration delay = policy.delayFor(attempts);
            assertThat(delay).isGreaterThanOrEqualTo(previous);
            previous = delay;
        }
    }

    @Test
    void transientFailureRequeuesWithBackoff() {
        RetryDecision decision = policy.decide(0, FailureKind.TRANSIENT, NOW);

        assertThat(decision.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(decision.attempts()).isEqualTo(1);
        assertThat(decision.nextEligibleAt()).isEqualTo(NOW.plusSeconds(120));
        assertThat(decision.quarantined()).isFalse();
    }

    @Test
    void sixthConsecutiveTransientFailureQuarantines() {
        int attempts = 0;
        for (int i = 1; i <= 5; i++) {
            RetryDecision decision = policy.decide(attempts, FailureKind.TRANSIENT, NOW);
            assertThat(decision.status()).as("failure %d", i).isEqualTo(JobStatus.QUEUED);
            attempts = decision.attempts();
        }
        RetryDecision sixth = policy.decide(attempts, FailureKind.TRANSIENT, NOW);

        assertThat(sixth.status()).isEqualTo(JobStatus.BLOCKED);
        assertThat(sixth.attempts()).isEqualTo(6);
        assertThat(sixth.quarantined()).isTrue();
    }

    @Test
    void permanentFailureIsTerminalWithoutConsumingAttempts() {
        RetryDecision decision = policy.decide(2, FailureKind.PERMANENT, NOW);

        assertThat(decision.status()).isEqualTo(JobStatus.FAILED);
        assertThat(decision.attempts()).isEqualTo(2);
    }

    @Test
    void sizeLimitIsTreatedAsPermanent() {
        assertThat(policy.decide(0, FailureKind.SIZE_LIMIT, NOW).status()).isEqualTo(JobStatus.FAILED);
    }
}
