package com.scout.pipeline.ops.service;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.model.CrawlJob;
import com.scout.pipeline.crawl.model.DomainPressure;
import com.scout.pipeline.crawl.model.EnqueueResult;
import com.scout.pipeline.crawl.model.JobStatus;
import com.scout.pipeline.crawl.model.PageCacheEntry;
import com.scout.pipeline.crawl.model.ResourceInspection;
import com.scout.pipeline.crawl.persistence.CrawlJobRepository;
import com.scout.pipeline.crawl.persistence.CrawlSourceRepository;
import com.scout.pipeline.crawl.persistence.PageCacheRepository;
import com.scout.pipeline.crawl.service.CrawlQueueService;
import com.scout.pipeline.crawl.service.DomainAdmissionService;
import com.scout.pipeline.crawl.service.UnknownTargetException;
import com.scout.pipeline.crawl.util.UrlUtils;
import com.scout.pipeline.ingest.persistence.IntakeRepository;
import com.scout.pipeline.ops.model.EmergencyStopResult;
import com.scout.pipeline.ops.model.PipelineHealth;
import com.scout.pipeline.ops.model.QuarantineResult;
import com.scout.pipeline.ops.model.ReleaseRequest;
import com.scout.pipeline.ops.model.ReleaseResult;
import com.scout.pipeline.ops.model.RetentionResult;
import com.scout.pipeline.ops.model.SeedResult;
import com.scout.pipeline.ops.model.SweepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class OperationalControlService {
    private static final Logger log = LoggerFactory.getLogger(OperationalControlService.class);

    private final CrawlQueueService queueService;
    private final CrawlJobRepository jobRepository;
    private final CrawlSourceRepository sourceRepository;
    private final PageCacheRepository pageCacheRepository;
    private final IntakeRepository intakeRepository;
    private final DomainAdmissionService admissionService;
    private final LeaseSweepService leaseSweepService;
    private final PipelineProperties properties;
    private final Clock clock;

    public OperationalControlService(
        CrawlQueueService queueService,
        CrawlJobRepository jobRepository,
        CrawlSourceRepository sourceRepository,
        PageCacheRepository pageCacheRepository,
        IntakeRepository intakeRepository,
        DomainAdmissionService admissionService,
        LeaseSweepService leaseSweepService,
        PipelineProperties properties,
        Clock clock
    ) {
        this.queueService = queueService;
        this.jobRepository = jobRepository;
        this.sourceRepository = sourceRepository;
        this.pageCacheRepository = pageCacheRepository;
        this.intakeRepository = intakeRepository;
        this.admissionService = admissionService;
        this.leaseSweepService = leaseSweepService;
        this.properties = properties;
        this.clock = clock;
    }

    public SeedResult enqueueSeed(String source, List<String> urls, Integer priority) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
        if (urls == null || urls.isEmpty()) {
            throw new IllegalArgumentException("at least one url is required");
        }
        int seedPriority = priority == null ? properties.getQueue().getSeedPriority() : priority;
        int created = 0;
        int existing = 0;
        List<String> rejected = new ArrayList<>();
        for (String url : urls) {
            if (UrlUtils.normalizeResource(url) == null) {
                rejected.add(url);
                continue;
            }
            EnqueueResult result = queueService.enqueue(source, url, seedPriority, null, 0, "seed");
            if (result.created()) {
                created++;
            } else {
                existing++;
            }
        }
        log.info("Seeded source {}: requested={} created={} existing={} rejected={}",
            source, urls.size(), created, existing, rejected.size());
        return new SeedResult(source.trim(), urls.size(), created, existing, rejected);
    }

    public void throttleDomain(String domain, long spacingMs) {
        admissionService.throttle(domain, spacingMs, clock.instant());
    }

    /**
     * Stops a source: marks it quarantined and blocks its queued jobs. Running jobs finish their
     * current attempt.
     */
    public QuarantineResult quarantineSource(String sourceId, String reason) {
        String source = requireText(sourceId, "sourceId");
        if (!sourceRepository.exists(source)) {
            throw new UnknownTargetException("Unknown source " + source);
        }
        Instant now = clock.instant();
        String effectiveReason = reason == null || reason.isBlank() ? "operator_quarantine" : reason.trim();
        sourceRepository.setQuarantined(source, true, effectiveReason, now);
        int blocked = jobRepository.blockQueuedForSource(source, "quarantined: " + effectiveReason, now);
        log.warn("Source {} quarantined ({}); {} queued jobs blocked", source, effectiveReason, blocked);
        return new QuarantineResult(source, effectiveReason, blocked);
    }

    public ReleaseResult releaseQuarantine(ReleaseRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("a release target is required");
        }
        Instant now = clock.instant();
        if (request.jobId() != null) {
            jobRepository.findById(request.jobId())
                .orElseThrow(() -> new UnknownTargetException("Unknown crawl job " + request.jobId()));
            int released = jobRepository.releaseJob(request.jobId(), now);
            log.info("Released crawl job {} ({} rows)", request.jobId(), released);
            return new ReleaseResult("job:" + request.jobId(), released, false);
        }
        if (request.sourceId() != null && !request.sourceId().isBlank()) {
            String source = request.sourceId().trim();
            if (!sourceRepository.exists(source)) {
                throw new UnknownTargetException("Unknown source " + source);
            }
            boolean unquarantined = sourceRepository.setQuarantined(source, false, null, now) > 0;
            int released = jobRepository.releaseSource(source, now);
            log.info("Released source {}: {} jobs requeued", source, released);
            return new ReleaseResult("source:" + source, released, unquarantined);
        }
        if (request.domain() != null && !request.domain().isBlank()) {
            String domain = UrlUtils.normalizeDomain(request.domain());
            int released = jobRepository.releaseDomain(domain, now);
            log.info("Released domain {}: {} jobs requeued", domain, released);
            return new ReleaseResult("domain:" + domain, released, false);
        }
        if (request.intakeId() != null) {
            intakeRepository.findById(request.intakeId())
                .orElseThrow(() -> new UnknownTargetException("Unknown intake record " + request.intakeId()));
            int released = intakeRepository.releaseBlocked(request.intakeId(), now);
            log.info("Released intake {} ({} rows)", request.intakeId(), released);
            return new ReleaseResult("intake:" + request.intakeId(), released, false);
        }
        throw new IllegalArgumentException("one of jobId, sourceId, domain or intakeId is required");
    }

    /**
     * Drops every lease and slows every domain down in one transaction. Workers that are mid-fetch
     * will find their lease gone and their completion ignored.
     */
    @Transactional
    public EmergencyStopResult emergencyStop() {
        Instant now = clock.instant();
        long spacingMs = properties.getAdmission().getEmergencySpacingMs();
        int crawlRequeued = jobRepository.requeueAllRunning(now);
        int intakeRequeued = intakeRepository.requeueAllRunning(now);
        int domains = admissionService.raiseAllSpacing(spacingMs, now);
        log.warn("Emergency stop: {} crawl jobs and {} intake records requeued, {} domains throttled to {}ms",
            crawlRequeued, intakeRequeued, domains, spacingMs);
        return new EmergencyStopResult(crawlRequeued, intakeRequeued, domains, spacingMs, now);
    }

    public int retryFailed(String resource) {
        String normalized = resource == null || resource.isBlank() ? null : UrlUtils.normalizeResource(resource);
        if (resource != null && !resource.isBlank() && normalized == null) {
            throw new IllegalArgumentException("resource must be an absolute http(s) URL: " + resource);
        }
        int reset = jobRepository.retryFailed(normalized, clock.instant());
        log.info("Reset {} failed crawl jobs{}", reset, normalized == null ? "" : " for " + normalized);
        return reset;
    }

    public SweepResult sweepStaleLeases() {
        return leaseSweepService.sweep();
    }

    public PipelineHealth health() {
        Instant now = clock.instant();
        Instant dayAgo = now.minus(Duration.ofHours(24));
        return new PipelineHealth(
            jobRepository.countByStatus(JobStatus.QUEUED),
            jobRepository.countByStatus(JobStatus.RUNNING),
            jobRepository.countFinishedSince(JobStatus.FAILED, dayAgo),
            jobRepository.countFinishedSince(JobStatus.DONE, dayAgo),
            sourceRepository.countQuarantined(),
            jobRepository.countByStatus(JobStatus.BLOCKED),
            intakeRepository.countByStatus(JobStatus.QUEUED),
            intakeRepository.countFailuresSince(dayAgo),
            now
        );
    }

    public ResourceInspection inspect(String sourceId, String resource) {
        String source = requireText(sourceId, "source");
        String normalized = UrlUtils.normalizeResource(resource);
        if (normalized == null) {
            throw new IllegalArgumentException("resource must be an absolute http(s) URL: " + resource);
        }
        Optional<CrawlJob> job = jobRepository.findByKey(source, normalized);
        Optional<PageCacheEntry> cache = pageCacheRepository.find(source, normalized);
        if (job.isEmpty() && cache.isEmpty()) {
            throw new UnknownTargetException("Nothing known about " + normalized + " for source " + source);
        }
        return new ResourceInspection(
            job.map(CrawlJob::jobId).orElse(null),
            source,
            normalized,
            job.map(CrawlJob::status).orElse(null),
            job.map(CrawlJob::attempts).orElse(0),
            job.map(CrawlJob::lastError).orElse(null),
            job.map(CrawlJob::nextEligibleAt).orElse(null),
            cache.map(PageCacheEntry::fetchedAt).orElse(null),
            cache.map(PageCacheEntry::httpStatus).orElse(null),
            cache.map(PageCacheEntry::parseStatus).orElse(null),
            cache.map(PageCacheEntry::parseNote).orElse(null),
            jobRepository.countChildren(source, normalized)
        );
    }

    public List<DomainPressure> queuePressure() {
        return jobRepository.fetchDomainPressure();
    }

    public RetentionResult purgeExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getQueue().getRetentionDays()));
        int jobs = queueService.purgeFinished(cutoff);
        int history = intakeRepository.purgeHistory(cutoff);
        if (history > 0) {
            log.info("Purged {} ingestion history rows older than {}", history, cutoff);
        }
        return new RetentionResult(jobs, history, cutoff);
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value.trim();
    }
}
