package com.scout.pipeline.crawl.service;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.model.CrawlJob;
import com.scout.pipeline.crawl.model.EnqueueResult;
import com.scout.pipeline.crawl.model.FailureKind;
import com.scout.pipeline.crawl.model.JobStatus;
import com.scout.pipeline.crawl.model.RecrawlOutcome;
import com.scout.pipeline.crawl.model.RetryDecision;
import com.scout.pipeline.crawl.persistence.CrawlJobRepository;
import com.scout.pipeline.crawl.persistence.CrawlSourceRepository;
import com.scout.pipeline.crawl.util.FailureClassifier;
import com.scout.pipeline.crawl.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class CrawlQueueService {
    private static final Logger log = LoggerFactory.getLogger(CrawlQueueService.class);

    private final CrawlJobRepository jobRepository;
    private final CrawlSourceRepository sourceRepository;
    private final DomainAdmissionService admissionService;
    private final RetryPolicy retryPolicy;
    private final PipelineProperties properties;
    private final Clock clock;

    public CrawlQueueService(
        CrawlJobRepository jobRepository,
        CrawlSourceRepository sourceRepository,
        DomainAdmissionService admissionService,
        RetryPolicy retryPolicy,
        PipelineProperties properties,
        Clock clock
    ) {
        this.jobRepository = jobRepository;
        this.sourceRepository = sourceRepository;
        this.admissionService = admissionService;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
        this.clock = clock;
    }

    public EnqueueResult enqueue(String sourceKey, String resource, int priority, String parentResource, int depth) {
        return enqueue(sourceKey, resource, priority, parentResource, depth, null);
    }

    /**
     * Idempotent on (source, resource): an existing row in any state is left untouched.
     */
    public EnqueueResult enqueue(
        String sourceKey,
        String resource,
        int priority,
        String parentResource,
        int depth,
        String note
    ) {
        String source = requireSource(sourceKey);
        String normalized = UrlUtils.normalizeResource(resource);
        if (normalized == null) {
            throw new IllegalArgumentException("resource must be an absolute http(s) URL: " + resource);
        }
        String domain = UrlUtils.domainOf(normalized);
        Instant now = clock.instant();

        Optional<CrawlJob> existing = jobRepository.findByKey(source, normalized);
        if (existing.isPresent()) {
            return new EnqueueResult(existing.get().jobId(), false, existing.get().status());
        }

        sourceRepository.ensureSource(source, now);
        admissionService.ensureDomain(domain, now);
        JobStatus status = sourceRepository.isQuarantined(source) ? JobStatus.BLOCKED : JobStatus.QUEUED;
        Long jobId = jobRepository.insert(
            source,
            domain,
            normalized,
            depth,
            clampPriority(priority),
            status,
            parentResource,
            note,
            now
        );
        if (jobId == null) {
            CrawlJob raced = jobRepository.findByKey(source, normalized).orElse(null);
            return new EnqueueResult(raced == null ? null : raced.jobId(), false, raced == null ? null : raced.status());
        }
        log.debug("Enqueued job {} source={} resource={} priority={} status={}", jobId, source, normalized, priority, status);
        return new EnqueueResult(jobId, true, status);
    }

    /**
     * Claims the most urgent eligible job whose domain is currently admitted. Candidates lost to a
     * concurrent worker are skipped, never waited on.
     */
    public Optional<CrawlJob> claimNext(String workerId) {
        String owner = requireWorker(workerId);
        Instant now = clock.instant();
        List<CrawlJob> candidates = jobRepository.findClaimCandidates(now, properties.getQueue().getClaimScanLimit());
        for (CrawlJob candidate : candidates) {
            if (!admissionService.admits(candidate.domain(), now)) {
                continue;
            }
            if (!jobRepository.tryClaim(candidate.jobId(), owner, now)) {
                log.debug("Lease conflict on job {}; another worker claimed it first", candidate.jobId());
                continue;
            }
            admissionService.recordClaim(candidate.domain(), now);
            return jobRepository.findById(candidate.jobId());
        }
        return Optional.empty();
    }

    public boolean complete(long jobId, String workerId) {
        Instant now = clock.instant();
        CrawlJob job = jobRepository.findById(jobId)
            .orElseThrow(() -> new UnknownTargetException("Unknown crawl job " + jobId));
        if (!jobRepository.markDone(jobId, workerId, now)) {
            log.warn("Stale lease: job {} is no longer held by {} (status={}, owner={})",
                jobId, workerId, job.status(), job.leaseOwner());
            return false;
        }
        admissionService.recordRelease(job.domain(), now);
        return true;
    }

    public boolean fail(long jobId, String workerId, FailureKind kind, String reason) {
        Instant now = clock.instant();
        CrawlJob job = jobRepository.findById(jobId)
            .orElseThrow(() -> new UnknownTargetException("Unknown crawl job " + jobId));
        if (job.status() != JobStatus.RUNNING || workerId == null || !workerId.equals(job.leaseOwner())) {
            log.warn("Stale lease: ignoring {} failure for job {} held by {} (status={})",
                kind, jobId, job.leaseOwner(), job.status());
            return false;
        }
        RetryDecision decision = retryPolicy.decide(job.attempts(), kind, now);
        String error = FailureClassifier.truncate(kind.name() + ": " + (reason == null ? "" : reason));
        if (decision.status() == JobStatus.QUEUED && sourceRepository.isQuarantined(job.sourceKey())) {
            decision = new RetryDecision(JobStatus.BLOCKED, decision.attempts(), now);
            error = FailureClassifier.truncate("quarantined: " + error);
        }
        if (!jobRepository.applyFailure(jobId, workerId, decision, error, now)) {
            log.warn("Stale lease: job {} changed hands before its failure could be recorded", jobId);
            return false;
        }
        admissionService.recordRelease(job.domain(), now);
        if (decision.quarantined()) {
            log.warn("Job {} quarantined after {} attempts: {}", jobId, decision.attempts(), error);
        } else if (decision.status() == JobStatus.FAILED) {
            log.info("Job {} failed permanently: {}", jobId, error);
        } else {
            log.info("Job {} retry {} scheduled at {}", jobId, decision.attempts(), decision.nextEligibleAt());
        }
        return true;
    }

    /**
     * Makes a resource eligible again. Finished rows go back to the queue, queued rows are only
     * pulled earlier, and running or blocked rows are left alone. Nothing of a quarantined source
     * is requeued; its cache rows stay due and are picked up after release.
     */
    public RecrawlOutcome requeueForRecrawl(String sourceKey, String resource, Instant now) {
        String source = requireSource(sourceKey);
        Optional<CrawlJob> existing = jobRepository.findByKey(source, resource);
        if (existing.isEmpty()) {
            EnqueueResult result = enqueue(source, resource, properties.getQueue().getRecrawlPriority(), null, 0, "recrawl");
            return result.created() ? RecrawlOutcome.ENQUEUED : RecrawlOutcome.UNTOUCHED;
        }
        JobStatus status = existing.get().status();
        if (sourceRepository.isQuarantined(source)) {
            log.debug("Skipping recrawl of {} for quarantined source {}", resource, source);
            return RecrawlOutcome.UNTOUCHED;
        }
        if (status == JobStatus.DONE || status == JobStatus.FAILED) {
            int priority = Math.min(existing.get().priority(), properties.getQueue().getRecrawlPriority());
            return jobRepository.requeueFinished(source, resource, priority, now)
                ? RecrawlOutcome.REQUEUED
                : RecrawlOutcome.UNTOUCHED;
        }
        if (status == JobStatus.QUEUED) {
            return jobRepository.pullEligibilityEarlier(source, resource, now)
                ? RecrawlOutcome.PULLED_EARLIER
                : RecrawlOutcome.UNTOUCHED;
        }
        return RecrawlOutcome.UNTOUCHED;
    }

    public int purgeFinished(Instant cutoff) {
        int purged = jobRepository.purgeFinished(cutoff);
        if (purged > 0) {
            log.info("Purged {} finished crawl jobs older than {}", purged, cutoff);
        }
        return purged;
    }

    public Optional<CrawlJob> findJob(long jobId) {
        return jobRepository.findById(jobId);
    }

    static int clampPriority(int priority) {
        return Math.max(1, Math.min(9, priority));
    }

    private static String requireSource(String sourceKey) {
        if (sourceKey == null || sourceKey.isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
        return sourceKey.trim();
    }

    private static String requireWorker(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        return workerId.trim();
    }
}
