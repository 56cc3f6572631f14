package com.scout.pipeline.ops.service;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.model.CrawlJob;
import com.scout.pipeline.crawl.persistence.CrawlJobRepository;
import com.scout.pipeline.crawl.service.DomainAdmissionService;
import com.scout.pipeline.ingest.model.IntakeRecord;
import com.scout.pipeline.ingest.persistence.IntakeRepository;
import com.scout.pipeline.ops.model.SweepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Returns leases abandoned by dead workers to the queue. Each row is requeued with a
 * compare-and-swap on its owner and lease time, so a lease renewed after the scan is left alone.
 */
@Service
public class LeaseSweepService {
    private static final Logger log = LoggerFactory.getLogger(LeaseSweepService.class);

    private final CrawlJobRepository jobRepository;
    private final IntakeRepository intakeRepository;
    private final DomainAdmissionService admissionService;
    private final PipelineProperties properties;
    private final Clock clock;

    public LeaseSweepService(
        CrawlJobRepository jobRepository,
        IntakeRepository intakeRepository,
        DomainAdmissionService admissionService,
        PipelineProperties properties,
        Clock clock
    ) {
        this.jobRepository = jobRepository;
        this.intakeRepository = intakeRepository;
        this.admissionService = admissionService;
        this.properties = properties;
        this.clock = clock;
    }

    public SweepResult sweep() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofMinutes(properties.getQueue().getStaleLeaseMinutes()));

        List<CrawlJob> staleJobs = jobRepository.findStaleRunning(cutoff);
        int crawlRequeued = 0;
        for (CrawlJob job : staleJobs) {
            if (jobRepository.requeueStale(job, now)) {
                admissionService.recordRelease(job.domain(), now);
                crawlRequeued++;
                log.warn("Requeued stale crawl job {} ({}) held by {} since {}", job.jobId(), job.resource(), job.leaseOwner(), job.leaseAt());
            }
        }

        List<IntakeRecord> staleIntake = intakeRepository.findStaleRunning(cutoff);
        int intakeRequeued = 0;
        for (IntakeRecord record : staleIntake) {
            if (intakeRepository.requeueStale(record, now)) {
                intakeRequeued++;
                log.warn("Requeued stale intake {} ({}) held by {} since {}", record.intakeId(), record.fileName(), record.leaseOwner(), record.leaseAt());
            }
        }
        return new SweepResult(staleJobs.size(), crawlRequeued, staleIntake.size(), intakeRequeued);
    }
}
