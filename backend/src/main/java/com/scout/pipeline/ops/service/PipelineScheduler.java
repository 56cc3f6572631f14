package com.scout.pipeline.ops.service;

import com.scout.pipeline.crawl.model.RecrawlSummary;
import com.scout.pipeline.crawl.service.RecrawlService;
import com.scout.pipeline.ops.model.RetentionResult;
import com.scout.pipeline.ops.model.SweepResult;
import com.scout.pipeline.transform.model.PromotionSummary;
import com.scout.pipeline.transform.model.RefreshSummary;
import com.scout.pipeline.transform.service.StagedTransformService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic maintenance. Every job catches its own failure so one broken job does not stop the others.
 */
@Component
@ConditionalOnProperty(name = "pipeline.scheduling.enabled", havingValue = "true")
public class PipelineScheduler {
    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final LeaseSweepService leaseSweepService;
    private final RecrawlService recrawlService;
    private final StagedTransformService transformService;
    private final OperationalControlService controlService;

    public PipelineScheduler(
        LeaseSweepService leaseSweepService,
        RecrawlService recrawlService,
        StagedTransformService transformService,
        OperationalControlService controlService
    ) {
        this.leaseSweepService = leaseSweepService;
        this.recrawlService = recrawlService;
        this.transformService = transformService;
        this.controlService = controlService;
    }

    @Scheduled(fixedDelayString = "${pipeline.scheduling.sweep-interval-ms:300000}")
    public void sweepStaleLeases() {
        try {
            SweepResult result = leaseSweepService.sweep();
            if (result.crawlRequeued() > 0 || result.intakeRequeued() > 0) {
                log.warn("Lease sweep requeued {} crawl jobs and {} intake records", result.crawlRequeued(), result.intakeRequeued());
            }
        } catch (Exception e) {
            log.error("Lease sweep failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${pipeline.scheduling.recrawl-interval-ms:900000}")
    public void scheduleRecrawl() {
        try {
            RecrawlSummary summary = recrawlService.scheduleRecrawl();
            if (summary.scanned() > 0) {
                log.info("Recrawl scan: scanned={} requeued={} enqueued={} pulledEarlier={}",
                    summary.scanned(), summary.requeued(), summary.enqueued(), summary.pulledEarlier());
            }
        } catch (Exception e) {
            log.error("Recrawl scheduling failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${pipeline.scheduling.transform-interval-ms:120000}")
    public void runTransform() {
        try {
            PromotionSummary promotion = transformService.promote();
            RefreshSummary refresh = transformService.refreshAggregates();
            log.info("Transform run: promoted={} failed={} refreshed={}",
                promotion.inserted() + promotion.updated(), promotion.failed(),
                refresh.acquired() ? refresh.refreshes().size() : "skipped");
        } catch (Exception e) {
            log.error("Transform run failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${pipeline.scheduling.retention-interval-ms:86400000}")
    public void purgeExpired() {
        try {
            RetentionResult result = controlService.purgeExpired();
            log.info("Retention: purged {} crawl jobs and {} history rows before {}",
                result.crawlJobsPurged(), result.historyRowsPurged(), result.cutoff());
        } catch (Exception e) {
            log.error("Retention purge failed: {}", e.getMessage(), e);
        }
    }
}
