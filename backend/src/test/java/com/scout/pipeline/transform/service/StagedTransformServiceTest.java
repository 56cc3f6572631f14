package com.scout.pipeline.transform.service;

import com.scout.pipeline.transform.model.LayerCounts;
import com.scout.pipeline.transform.model.LayerFreshness;
import com.scout.pipeline.transform.model.PromotionSummary;
import com.scout.pipeline.transform.model.RefreshSummary;
import com.scout.pipeline.transform.model.SilverRecord;
import com.scout.pipeline.transform.persistence.BronzeRepository;
import com.scout.pipeline.transform.persistence.GoldAggregateRepository;
import com.scout.pipeline.transform.persistence.PipelineLockRepository;
import com.scout.pipeline.transform.persistence.SilverRepository;
import com.scout.pipeline.transform.persistence.WatermarkRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Promotion commits per record, so these tests run outside a test transaction and clean up their
 * own rows.
 */
@SpringBootTest
@ActiveProfiles("test")
class StagedTransformServiceTest {
    private static final String REFRESH_LOCK = "gold-refresh";

    @Autowired
    private StagedTransformService transformService;

    @Autowired
    private BronzeRepository bronzeRepository;

    @Autowired
    private SilverRepository silverRepository;

    @Autowired
    private WatermarkRepository watermarkRepository;

    @Autowired
    private GoldAggregateRepository goldRepository;

    @Autowired
    private PipelineLockRepository lockRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    private final String prefix = "transform-" + UUID.randomUUID().toString().substring(0, 8);

    @AfterEach
    void cleanUp() {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("pattern", prefix + "%");
        jdbc.update("DELETE FROM silver_records WHERE source_file LIKE :pattern OR natural_key LIKE :pattern", params);
        jdbc.update("DELETE FROM etl_watermarks WHERE object_id LIKE :pattern", params);
        jdbc.update("DELETE FROM bronze_raw_events WHERE source_file LIKE :pattern", params);
        jdbc.update("DELETE FROM gold_source_file_metrics WHERE source_file LIKE :pattern", params);
        jdbc.update("DELETE FROM gold_daily_metrics WHERE store_key LIKE :pattern", params);
    }

    @Test
    void latestEventTimeWinsRegardlessOfArrivalOrder() {
        String key = prefix + "-txn-1";
        land("/feb.json", "row-0", key, "{\"timestamp\": \"2026-02-01T00:00:00Z\", \"amount\": 20}");
        land("/jan.json", "row-0", key, "{\"timestamp\": \"2026-01-01T00:00:00Z\", \"amount\": 10}");

        PromotionSummary summary = transformService.promote();

        assertThat(summary.inserted()).isGreaterThanOrEqualTo(1);
        assertThat(summary.staleIgnored()).isGreaterThanOrEqualTo(1);
        SilverRecord record = silverRepository.findByKey(key).orElseThrow();
        assertThat(record.eventTime()).isEqualTo(Instant.parse("2026-02-01T00:00:00Z"));
        assertThat(record.amount()).isEqualByComparingTo(new BigDecimal("20.00"));
        assertThat(record.sourceFile()).isEqualTo(prefix + "/feb.json");
    }

    @Test
    void newerEventReplacesOlderOne() {
        String key = prefix + "-txn-2";
        land("/jan.json", "row-0", key, "{\"timestamp\": \"2026-01-01T00:00:00Z\", \"amount\": 10}");
        transformService.promote();

        land("/mar.json", "row-0", key, "{\"timestamp\": \"2026-03-01T00:00:00Z\", \"amount\": 30}");
        PromotionSummary summary = transformService.promote();

        assertThat(summary.updated()).isEqualTo(1);
        assertThat(silverRepository.findByKey(key).orElseThrow().amount()).isEqualByComparingTo(new BigDecimal("30.00"));
    }

    @Test
    void watermarkedEventsAreNotPromotedTwice() {
        land("/once.json", "row-0", prefix + "-txn-3", "{\"amount\": 1}");

        PromotionSummary first = transformService.promote();
        PromotionSummary second = transformService.promote();

        assertThat(first.scanned()).isGreaterThanOrEqualTo(1);
        assertThat(second.scanned()).isZero();
        String objectId = BronzeRepository.objectKey(prefix + "/once.json", "row-0");
        assertThat(watermarkRepository.findOk(objectId)).contains(true);
    }

    @Test
    void failedEventIsWatermarkedAndRetried() {
        land("/bad.json", "row-0", null, "[\"not\", \"an\", \"object\"]");
        String objectId = BronzeRepository.objectKey(prefix + "/bad.json", "row-0");

        PromotionSummary first = transformService.promote();
        PromotionSummary second = transformService.promote();

        assertThat(first.failed()).isEqualTo(1);
        assertThat(second.failed()).isEqualTo(1);
        assertThat(watermarkRepository.findOk(objectId)).contains(false);
    }

    @Test
    void refreshRebuildsGoldFromSilver() {
        String store = prefix + "-store";
        land("/day.json", "row-0", prefix + "-a", "{\"timestamp\": \"2026-03-01T09:00:00Z\", \"store_id\": \"" + store + "\", \"amount\": 5}");
        land("/day.json", "row-1", prefix + "-b", "{\"timestamp\": \"2026-03-01T11:00:00Z\", \"store_id\": \"" + store + "\", \"amount\": 7.5}");
        transformService.promote();

        RefreshSummary summary = transformService.refreshAggregates();

        assertThat(summary.acquired()).isTrue();
        assertThat(summary.refreshes()).extracting(refresh -> refresh.aggregateName())
            .containsExactly(GoldAggregateRepository.DAILY_METRICS, GoldAggregateRepository.SOURCE_FILE_METRICS);
        BigDecimal dailyTotal = jdbc.queryForObject(
            "SELECT total_amount FROM gold_daily_metrics WHERE store_key = :store",
            new MapSqlParameterSource().addValue("store", store),
            BigDecimal.class
        );
        Long fileCount = jdbc.queryForObject(
            "SELECT record_count FROM gold_source_file_metrics WHERE source_file = :file",
            new MapSqlParameterSource().addValue("file", prefix + "/day.json"),
            Long.class
        );
        assertThat(dailyTotal).isEqualByComparingTo(new BigDecimal("12.50"));
        assertThat(fileCount).isEqualTo(2L);
        assertThat(lockRepository.findOwner(REFRESH_LOCK)).isEmpty();
        assertThat(transformService.recentRefreshes(2)).hasSize(2);
    }

    @Test
    void layerCountsReportWhenEachLayerWasLastWritten() {
        Instant before = Instant.now().minusSeconds(1);
        land("/fresh.json", "row-0", prefix + "-fresh", "{\"timestamp\": \"2026-03-02T08:00:00Z\", \"amount\": 3}");
        transformService.promote();
        transformService.refreshAggregates();

        LayerCounts counts = transformService.layerCounts();

        assertThat(counts.bronze()).isGreaterThanOrEqualTo(1);
        assertThat(counts.silver()).isGreaterThanOrEqualTo(1);
        LayerFreshness freshness = counts.freshness();
        assertThat(freshness.bronzeIngestedAt()).isAfterOrEqualTo(before);
        assertThat(freshness.silverUpdatedAt()).isAfterOrEqualTo(before);
        assertThat(freshness.watermarkProcessedAt()).isAfterOrEqualTo(before);
        assertThat(freshness.goldRefreshedAt()).isAfterOrEqualTo(before);
    }

    @Test
    void refreshIsSkippedWhileAnotherInstanceHoldsTheLock() {
        Instant now = Instant.now();
        assertThat(lockRepository.tryAcquire(REFRESH_LOCK, "other-instance", now, now.plusSeconds(600))).isTrue();
        try {
            RefreshSummary summary = transformService.refreshAggregates();

            assertThat(summary.acquired()).isFalse();
            assertThat(summary.refreshes()).isEmpty();
            assertThat(lockRepository.findOwner(REFRESH_LOCK)).contains("other-instance");
        } finally {
            lockRepository.release(REFRESH_LOCK, "other-instance");
        }
    }

    @Test
    void expiredLockIsTakenOver() {
        Instant past = Instant.now().minusSeconds(3600);
        assertThat(lockRepository.tryAcquire(REFRESH_LOCK, "crashed-instance", past, past.plusSeconds(60))).isTrue();

        RefreshSummary summary = transformService.refreshAggregates();

        assertThat(summary.acquired()).isTrue();
        assertThat(lockRepository.findOwner(REFRESH_LOCK)).isEmpty();
    }

    private void land(String file, String entry, String txnId, String payload) {
        bronzeRepository.land(prefix + file, entry, txnId, payload, Instant.now());
    }
}
