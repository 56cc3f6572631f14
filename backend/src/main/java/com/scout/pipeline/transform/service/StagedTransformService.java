package com.scout.pipeline.transform.service;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.util.FailureClassifier;
import com.scout.pipeline.transform.model.AggregateRefresh;
import com.scout.pipeline.transform.model.LayerCounts;
import com.scout.pipeline.transform.model.LayerFreshness;
import com.scout.pipeline.transform.model.PromotionSummary;
import com.scout.pipeline.transform.model.RawEvent;
import com.scout.pipeline.transform.model.RefreshSummary;
import com.scout.pipeline.transform.model.SilverRecord;
import com.scout.pipeline.transform.model.UpsertOutcome;
import com.scout.pipeline.transform.persistence.BronzeRepository;
import com.scout.pipeline.transform.persistence.GoldAggregateRepository;
import com.scout.pipeline.transform.persistence.PipelineLockRepository;
import com.scout.pipeline.transform.persistence.SilverRepository;
import com.scout.pipeline.transform.persistence.WatermarkRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Moves data bronze to silver to gold. Promotion is incremental by watermark; gold refresh is
 * serialized across instances by a named lock.
 */
@Service
public class StagedTransformService {
    private static final Logger log = LoggerFactory.getLogger(StagedTransformService.class);

    private final BronzeRepository bronzeRepository;
    private final SilverRepository silverRepository;
    private final WatermarkRepository watermarkRepository;
    private final GoldAggregateRepository goldRepository;
    private final PipelineLockRepository lockRepository;
    private final NaturalKeyExtractor keyExtractor;
    private final TransactionTemplate transactionTemplate;
    private final PipelineProperties properties;
    private final Clock clock;
    private final String instanceId;

    public StagedTransformService(
        BronzeRepository bronzeRepository,
        SilverRepository silverRepository,
        WatermarkRepository watermarkRepository,
        GoldAggregateRepository goldRepository,
        PipelineLockRepository lockRepository,
        NaturalKeyExtractor keyExtractor,
        PlatformTransactionManager transactionManager,
        PipelineProperties properties,
        Clock clock
    ) {
        this.bronzeRepository = bronzeRepository;
        this.silverRepository = silverRepository;
        this.watermarkRepository = watermarkRepository;
        this.goldRepository = goldRepository;
        this.lockRepository = lockRepository;
        this.keyExtractor = keyExtractor;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.properties = properties;
        this.clock = clock;
        this.instanceId = properties.getWorkerId() != null
            ? properties.getWorkerId()
            : "transform-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    /**
     * Promotes every raw event without a successful watermark. Each event is upserted and
     * watermarked in one transaction; failures are watermarked not-ok and retried on the next run.
     */
    public PromotionSummary promote() {
        int batchSize = properties.getTransform().getPromoteBatchSize();
        long cursor = 0L;
        PromotionSummary total = PromotionSummary.empty();
        while (true) {
            List<RawEvent> batch = bronzeRepository.findUnpromoted(cursor, batchSize);
            if (batch.isEmpty()) {
                break;
            }
            int inserted = 0;
            int updated = 0;
            int stale = 0;
            int failed = 0;
            for (RawEvent event : batch) {
                cursor = Math.max(cursor, event.eventId());
                try {
                    UpsertOutcome outcome = promoteOne(event);
                    switch (outcome) {
                        case INSERTED -> inserted++;
                        case UPDATED -> updated++;
                        case STALE_IGNORED -> stale++;
                    }
                } catch (Exception e) {
                    failed++;
                    String message = FailureClassifier.describe(e);
                    log.warn("Promotion failed for raw event {} ({}): {}", event.eventId(), event.objectKey(), message);
                    watermarkRepository.markFailure(event.objectKey(), message, clock.instant());
                }
            }
            total = total.plus(new PromotionSummary(batch.size(), inserted, updated, stale, failed));
            if (batch.size() < batchSize) {
                break;
            }
        }
        if (total.scanned() > 0) {
            log.info("Promoted {} raw events: inserted={} updated={} stale={} failed={}",
                total.scanned(), total.inserted(), total.updated(), total.staleIgnored(), total.failed());
        }
        return total;
    }

    /**
     * Rebuilds the gold aggregates under the refresh lock. When another instance holds the lock the
     * run is skipped and {@code acquired=false} is returned.
     */
    public RefreshSummary refreshAggregates() {
        String lockName = properties.getTransform().getRefreshLockName();
        String owner = instanceId + "-" + UUID.randomUUID();
        Instant now = clock.instant();
        Instant expiresAt = now.plusSeconds(properties.getTransform().getRefreshLockTtlSeconds());
        if (!lockRepository.tryAcquire(lockName, owner, now, expiresAt)) {
            log.info("Skipping aggregate refresh; lock {} is held by {}", lockName, lockRepository.findOwner(lockName).orElse("?"));
            return RefreshSummary.skipped(owner);
        }
        List<AggregateRefresh> refreshes = new ArrayList<>();
        try {
            for (Map.Entry<String, Function<Instant, Integer>> aggregate : aggregates().entrySet()) {
                refreshes.add(refreshOne(aggregate.getKey(), aggregate.getValue(), owner));
            }
        } finally {
            if (!lockRepository.release(lockName, owner)) {
                log.warn("Refresh lock {} was no longer held by {} at release", lockName, owner);
            }
        }
        return new RefreshSummary(true, owner, refreshes);
    }

    public LayerCounts layerCounts() {
        return new LayerCounts(
            bronzeRepository.count(),
            silverRepository.count(),
            goldRepository.countDailyMetrics(),
            goldRepository.countSourceFileMetrics(),
            watermarkRepository.countByOk(true),
            watermarkRepository.countByOk(false),
            freshness()
        );
    }

    public LayerFreshness freshness() {
        return new LayerFreshness(
            bronzeRepository.latestIngestedAt(),
            silverRepository.latestUpdatedAt(),
            watermarkRepository.latestProcessedAt(),
            goldRepository.latestRefreshAt()
        );
    }

    public List<AggregateRefresh> recentRefreshes(int limit) {
        return goldRepository.listRefreshLog(limit);
    }

    private UpsertOutcome promoteOne(RawEvent event) {
        return transactionTemplate.execute(status -> {
            Instant now = clock.instant();
            SilverRecord record = keyExtractor.toSilver(event, now);
            UpsertOutcome outcome = silverRepository.upsert(record);
            watermarkRepository.markSuccess(event.objectKey(), now);
            return outcome;
        });
    }

    private AggregateRefresh refreshOne(String name, Function<Instant, Integer> rebuild, String owner) {
        return transactionTemplate.execute(status -> {
            long started = System.nanoTime();
            Instant now = clock.instant();
            int rows = rebuild.apply(now);
            AggregateRefresh refresh = new AggregateRefresh(
                name,
                rows,
                Duration.ofNanos(System.nanoTime() - started).toMillis(),
                owner,
                now
            );
            goldRepository.logRefresh(refresh);
            log.info("Refreshed {} rows={} in {}ms", name, rows, refresh.durationMs());
            return refresh;
        });
    }

    private Map<String, Function<Instant, Integer>> aggregates() {
        Map<String, Function<Instant, Integer>> aggregates = new LinkedHashMap<>();
        aggregates.put(GoldAggregateRepository.DAILY_METRICS, goldRepository::rebuildDailyMetrics);
        aggregates.put(GoldAggregateRepository.SOURCE_FILE_METRICS, goldRepository::rebuildSourceFileMetrics);
        return aggregates;
    }
}
