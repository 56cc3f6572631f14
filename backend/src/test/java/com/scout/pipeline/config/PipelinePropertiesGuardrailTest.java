package com.scout.pipeline.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelinePropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        PipelineProperties properties = new PipelineProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("scout-pipeline/0.1"));
    }

    @Test
    void blankWorkerIdMeansDerivedId() {
        PipelineProperties properties = new PipelineProperties();
        properties.setWorkerId("  ");
        assertNull(properties.getWorkerId());
    }

    @Test
    void prioritiesAreClampedToOneThroughNine() {
        PipelineProperties properties = new PipelineProperties();
        properties.getQueue().setSeedPriority(0);
        properties.getQueue().setRecrawlPriority(42);
        assertEquals(1, properties.getQueue().getSeedPriority());
        assertEquals(9, properties.getQueue().getRecrawlPriority());
    }

    @Test
    void retryAndSpacingAreClamped() {
        PipelineProperties properties = new PipelineProperties();
        properties.getRetry().setMaxDoublings(99);
        properties.getAdmission().setDefaultMinSpacingMs(-5);
        properties.getQueue().setClaimScanLimit(0);
        assertEquals(20, properties.getRetry().getMaxDoublings());
        assertEquals(0, properties.getAdmission().getDefaultMinSpacingMs());
        assertEquals(1, properties.getQueue().getClaimScanLimit());
    }

    @Test
    void intakeDefaultsMatchDocumentedLimits() {
        PipelineProperties properties = new PipelineProperties();
        assertEquals(200L * 1024 * 1024, properties.getIntake().getMaxFileBytes());
        assertEquals(List.of("edge-inbox/", "email-attachments/"), properties.getIntake().getAcceptedPrefixes());
        assertEquals(6, properties.getRetry().getQuarantineThreshold());
        assertEquals(120, properties.getQueue().getStaleLeaseMinutes());
    }
}
