package com.scout.pipeline.crawl.service;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.model.PageCacheEntry;
import com.scout.pipeline.crawl.model.RecrawlOutcome;
import com.scout.pipeline.crawl.model.RecrawlSummary;
import com.scout.pipeline.crawl.persistence.PageCacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
public class RecrawlService {
    private static final Logger log = LoggerFactory.getLogger(RecrawlService.class);

    private final PageCacheRepository cacheRepository;
    private final CrawlQueueService queueService;
    private final PipelineProperties properties;
    private final Clock clock;

    public RecrawlService(
        PageCacheRepository cacheRepository,
        CrawlQueueService queueService,
        PipelineProperties properties,
        Clock clock
    ) {
        this.cacheRepository = cacheRepository;
        this.queueService = queueService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Re-seeds cached resources whose age exceeds the TTL of their last parse outcome. Repeated
     * scans never add rows; at most they pull a queued row's eligibility earlier.
     */
    public RecrawlSummary scheduleRecrawl() {
        Instant now = clock.instant();
        PipelineProperties.Recrawl recrawl = properties.getRecrawl();
        Instant successCutoff = now.minus(Duration.ofHours(recrawl.getSuccessTtlHours()));
        Instant failureCutoff = now.minus(Duration.ofHours(recrawl.getFailureTtlHours()));
        List<PageCacheEntry> due = cacheRepository.findDueForRecrawl(successCutoff, failureCutoff, recrawl.getBatchSize());

        int requeued = 0;
        int enqueued = 0;
        int pulledEarlier = 0;
        int untouched = 0;
        for (PageCacheEntry entry : due) {
            RecrawlOutcome outcome;
            try {
                outcome = queueService.requeueForRecrawl(entry.sourceKey(), entry.resource(), now);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping recrawl of {}: {}", entry.resource(), e.getMessage());
                untouched++;
                continue;
            }
            switch (outcome) {
                case REQUEUED -> requeued++;
                case ENQUEUED -> enqueued++;
                case PULLED_EARLIER -> pulledEarlier++;
                default -> untouched++;
            }
        }
        RecrawlSummary summary = new RecrawlSummary(due.size(), requeued, enqueued, pulledEarlier, untouched);
        if (!due.isEmpty()) {
            log.info("Recrawl scan: {}", summary);
        }
        return summary;
    }
}
