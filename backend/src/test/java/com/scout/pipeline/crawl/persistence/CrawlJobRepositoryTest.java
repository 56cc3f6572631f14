package com.scout.pipeline.crawl.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.scout.pipeline.crawl.model.CrawlJob;
import com.scout.pipeline.crawl.model.JobStatus;
import com.scout.pipeline.crawl.model.RetryDecision;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CrawlJobRepositoryTest {

  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

  @Autowired private CrawlJobRepository repository;

  @Test
  void secondInsertForSameSourceAndResourceReturnsNull() {
    String source = "repo-" + UUID.randomUUID();
    String resource = "https://shop.example.com/a";

    Long first = repository.insert(source, "shop.example.com", resource, 0, 5, JobStatus.QUEUED, null, null, NOW);
    Long second = repository.insert(source, "shop.example.com", resource, 0, 1, JobStatus.QUEUED, null, null, NOW);

    assertNotNull(first);
    assertNull(second);
    assertEquals(5, repository.findById(first).orElseThrow().priority());
  }

  @Test
  void claimIsCompareAndSwap() {
    String source = "repo-" + UUID.randomUUID();
    long jobId = repository.insert(source, "shop.example.com", "https://shop.example.com/b", 0, 1, JobStatus.QUEUED, null, null, NOW);

    assertTrue(repository.tryClaim(jobId, "worker-a", NOW));
    assertFalse(repository.tryClaim(jobId, "worker-b", NOW));

    CrawlJob claimed = repository.findById(jobId).orElseThrow();
    assertEquals(JobStatus.RUNNING, claimed.status());
    assertEquals("worker-a", claimed.leaseOwner());
    assertFalse(repository.markDone(jobId, "worker-b", NOW));
    assertTrue(repository.markDone(jobId, "worker-a", NOW));
  }

  @Test
  void notYetEligibleJobsAreNotCandidates() {
    String source = "repo-" + UUID.randomUUID();
    long jobId = repository.insert(source, "shop.example.com", "https://shop.example.com/c", 0, 1, JobStatus.QUEUED, null, null, NOW);
    assertTrue(repository.tryClaim(jobId, "worker-a", NOW));
    RetryDecision retry = new RetryDecision(JobStatus.QUEUED, 1, NOW.plusSeconds(120));
    assertTrue(repository.applyFailure(jobId, "worker-a", retry, "TRANSIENT: http_503", NOW));

    List<CrawlJob> early = repository.findClaimCandidates(NOW.plusSeconds(60), 500);
    List<CrawlJob> later = repository.findClaimCandidates(NOW.plusSeconds(121), 500);

    assertTrue(early.stream().noneMatch(job -> job.jobId() == jobId));
    assertTrue(later.stream().anyMatch(job -> job.jobId() == jobId));
    assertFalse(repository.tryClaim(jobId, "worker-a", NOW.plusSeconds(60)));
  }

  @Test
  void staleLeaseIsRequeuedOnceAndLateReportIsRejected() {
    String source = "repo-" + UUID.randomUUID();
    long jobId = repository.insert(source, "shop.example.com", "https://shop.example.com/d", 0, 1, JobStatus.QUEUED, null, null, NOW);
    assertTrue(repository.tryClaim(jobId, "crashed-worker", NOW));

    Instant later = NOW.plus(Duration.ofHours(3));
    List<CrawlJob> stale = repository.findStaleRunning(later.minus(Duration.ofHours(2)));
    CrawlJob staleJob = stale.stream().filter(job -> job.jobId() == jobId).findFirst().orElseThrow();

    assertTrue(repository.requeueStale(staleJob, later));
    assertFalse(repository.requeueStale(staleJob, later));
    assertFalse(repository.markDone(jobId, "crashed-worker", later));

    CrawlJob requeued = repository.findById(jobId).orElseThrow();
    assertEquals(JobStatus.QUEUED, requeued.status());
    assertNull(requeued.leaseOwner());
    assertEquals("stale_lease_requeued", requeued.note());
  }

  @Test
  void releaseOnlyTouchesBlockedRows() {
    String source = "repo-" + UUID.randomUUID();
    long blocked = repository.insert(source, "shop.example.com", "https://shop.example.com/e", 0, 5, JobStatus.BLOCKED, null, null, NOW);
    long queued = repository.insert(source, "shop.example.com", "https://shop.example.com/f", 0, 5, JobStatus.QUEUED, null, null, NOW);

    assertEquals(1, repository.releaseSource(source, NOW.plusSeconds(5)));

    assertEquals(JobStatus.QUEUED, repository.findById(blocked).orElseThrow().status());
    assertEquals(0, repository.findById(blocked).orElseThrow().attempts());
    assertEquals(NOW, repository.findById(queued).orElseThrow().updatedAt());
  }
}
