package com.scout.pipeline.crawl.service;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.model.CrawlJob;
import com.scout.pipeline.crawl.model.EnqueueResult;
import com.scout.pipeline.crawl.model.FetchOutcome;
import com.scout.pipeline.crawl.model.PageCacheEntry;
import com.scout.pipeline.crawl.model.ParseStatus;
import com.scout.pipeline.crawl.persistence.PageCacheRepository;
import com.scout.pipeline.crawl.util.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Records fetch outcomes in the content cache and feeds discovered resources back into the queue.
 */
@Service
public class CrawlResultService {
    private static final Logger log = LoggerFactory.getLogger(CrawlResultService.class);

    private final PageCacheRepository cacheRepository;
    private final CrawlQueueService queueService;
    private final PipelineProperties properties;
    private final Clock clock;

    public CrawlResultService(
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

    public Optional<PageCacheEntry> findPrior(String sourceKey, String resource) {
        return cacheRepository.find(sourceKey, resource);
    }

    /**
     * Upserts the cache row and enqueues discovered children. Returns the number of new jobs created.
     */
    public int recordResult(CrawlJob job, FetchOutcome outcome) {
        Instant now = clock.instant();
        cacheRepository.upsert(new PageCacheEntry(
            job.sourceKey(),
            job.resource(),
            outcome.httpStatus(),
            outcome.etag(),
            outcome.lastModified(),
            outcome.contentSha256(),
            now,
            outcome.parseStatus() == null ? ParseStatus.ERROR : outcome.parseStatus(),
            FailureClassifier.truncate(outcome.parseNote())
        ));
        if (outcome.parseStatus() != ParseStatus.OK || outcome.discovered().isEmpty()) {
            return 0;
        }
        int childDepth = job.depth() + 1;
        if (childDepth > properties.getQueue().getMaxDepth()) {
            log.debug("Not following {} links from {}: depth {} exceeds max", outcome.discovered().size(), job.resource(), childDepth);
            return 0;
        }
        int childPriority = childPriority(job.priority());
        int created = 0;
        for (String child : outcome.discovered()) {
            try {
                EnqueueResult result = queueService.enqueue(job.sourceKey(), child, childPriority, job.resource(), childDepth, "discovered");
                if (result.created()) {
                    created++;
                }
            } catch (IllegalArgumentException e) {
                log.debug("Skipping discovered resource {} from {}: {}", child, job.resource(), e.getMessage());
            }
        }
        return created;
    }

    public void recordFailure(CrawlJob job, Integer httpStatus, String note) {
        cacheRepository.upsert(new PageCacheEntry(
            job.sourceKey(),
            job.resource(),
            httpStatus,
            null,
            null,
            null,
            clock.instant(),
            ParseStatus.ERROR,
            FailureClassifier.truncate(note)
        ));
    }

    int childPriority(int parentPriority) {
        int candidate = Math.max(parentPriority + 1, properties.getQueue().getDiscoveredPriority());
        return CrawlQueueService.clampPriority(candidate);
    }
}
