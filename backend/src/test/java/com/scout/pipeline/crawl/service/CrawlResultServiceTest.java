package com.scout.pipeline.crawl.service;

import com.scout.pipeline.MutableClock;
import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.model.CrawlJob;
import com.scout.pipeline.crawl.model.FetchOutcome;
import com.scout.pipeline.crawl.model.PageCacheEntry;
import com.scout.pipeline.crawl.model.ParseStatus;
import com.scout.pipeline.crawl.persistence.CrawlJobRepository;
import com.scout.pipeline.crawl.persistence.CrawlSourceRepository;
import com.scout.pipeline.crawl.persistence.DomainStateRepository;
import com.scout.pipeline.crawl.persistence.PageCacheRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CrawlResultServiceTest {
    private static final Instant START = Instant.parse("2026-03-02T10:00:00Z");

    @Autowired
    private CrawlJobRepository jobRepository;

    @Autowired
    private CrawlSourceRepository sourceRepository;

    @Autowired
    private DomainStateRepository domainStateRepository;

    @Autowired
    private PageCacheRepository cacheRepository;

    private PipelineProperties properties;
    private CrawlQueueService queueService;
    private CrawlResultService resultService;
    private String source;
    private String base;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.getQueue().setMaxDepth(2);
        MutableClock clock = new MutableClock(START);
        queueService = new CrawlQueueService(
            jobRepository,
            sourceRepository,
            new DomainAdmissionService(domainStateRepository, properties),
            new RetryPolicy(properties),
            properties,
            clock
        );
        resultService = new CrawlResultService(cacheRepository, queueService, properties, clock);
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        source = "result-" + suffix;
        base = "https://shop-" + suffix + ".example.com";
    }

    @Test
    void discoveredLinksBecomeChildJobs() {
        CrawlJob parent = claimedJob(base + "/", 3, 0);
        FetchOutcome outcome = new FetchOutcome(200, "\"e1\"", null, "hash-1", ParseStatus.OK, "links=2",
            List.of(base + "/a", base + "/b"));

        int created = resultService.recordResult(parent, outcome);

        assertThat(created).isEqualTo(2);
        CrawlJob child = jobRepository.findByKey(source, base + "/a").orElseThrow();
        assertThat(child.depth()).isEqualTo(1);
        assertThat(child.priority()).isEqualTo(properties.getQueue().getDiscoveredPriority());
        assertThat(child.parentResource()).isEqualTo(parent.resource());
        assertThat(jobRepository.countChildren(source, parent.resource())).isEqualTo(2);

        PageCacheEntry cached = cacheRepository.find(source, parent.resource()).orElseThrow();
        assertThat(cached.etag()).isEqualTo("\"e1\"");
        assertThat(cached.contentSha256()).isEqualTo("hash-1");
        assertThat(cached.fetchedAt()).isEqualTo(START);
    }

    @Test
    void rediscoveringKnownLinksCreatesNothing() {
        CrawlJob parent = claimedJob(base + "/", 3, 0);
        FetchOutcome outcome = new FetchOutcome(200, null, null, "hash-1", ParseStatus.OK, null, List.of(base + "/a"));

        assertThat(resultService.recordResult(parent, outcome)).isEqualTo(1);
        assertThat(resultService.recordResult(parent, outcome)).isZero();
    }

    @Test
    void linksBeyondMaxDepthAreNotFollowed() {
        CrawlJob deep = claimedJob(base + "/deep", 5, 2);
        FetchOutcome outcome = new FetchOutcome(200, null, null, "hash-2", ParseStatus.OK, null, List.of(base + "/deeper"));

        assertThat(resultService.recordResult(deep, outcome)).isZero();
        assertThat(jobRepository.findByKey(source, base + "/deeper")).isEmpty();
    }

    @Test
    void notModifiedKeepsPreviousFingerprint() {
        CrawlJob job = claimedJob(base + "/stable", 3, 0);
        resultService.recordResult(job, new FetchOutcome(200, "\"v1\"", "Mon, 02 Mar 2026 09:00:00 GMT", "hash-3",
            ParseStatus.OK, null, List.of()));

        resultService.recordResult(job, new FetchOutcome(304, null, null, null, ParseStatus.NOT_MODIFIED, "not_modified", List.of()));

        PageCacheEntry cached = cacheRepository.find(source, job.resource()).orElseThrow();
        assertThat(cached.httpStatus()).isEqualTo(304);
        assertThat(cached.parseStatus()).isEqualTo(ParseStatus.NOT_MODIFIED);
        assertThat(cached.contentSha256()).isEqualTo("hash-3");
        assertThat(cached.etag()).isEqualTo("\"v1\"");
    }

    @Test
    void failuresAreCachedAsErrors() {
        CrawlJob job = claimedJob(base + "/broken", 3, 0);

        resultService.recordFailure(job, 503, "http_503");

        PageCacheEntry cached = cacheRepository.find(source, job.resource()).orElseThrow();
        assertThat(cached.parseStatus()).isEqualTo(ParseStatus.ERROR);
        assertThat(cached.httpStatus()).isEqualTo(503);
    }

    @Test
    void childPriorityIsNeverMoreUrgentThanParent() {
        assertThat(resultService.childPriority(1)).isEqualTo(6);
        assertThat(resultService.childPriority(7)).isEqualTo(8);
        assertThat(resultService.childPriority(9)).isEqualTo(9);
    }

    private CrawlJob claimedJob(String resource, int priority, int depth) {
        long jobId = queueService.enqueue(source, resource, priority, null, depth).jobId();
        return jobRepository.findById(jobId).orElseThrow();
    }
}
