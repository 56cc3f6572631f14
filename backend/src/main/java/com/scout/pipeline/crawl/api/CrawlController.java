package com.scout.pipeline.crawl.api;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.model.CrawlJob;
import com.scout.pipeline.crawl.model.DomainPressure;
import com.scout.pipeline.crawl.model.DomainState;
import com.scout.pipeline.crawl.model.EnqueueResult;
import com.scout.pipeline.crawl.model.RecrawlSummary;
import com.scout.pipeline.crawl.model.ResourceInspection;
import com.scout.pipeline.crawl.service.CrawlQueueService;
import com.scout.pipeline.crawl.service.DomainAdmissionService;
import com.scout.pipeline.crawl.service.RecrawlService;
import com.scout.pipeline.crawl.service.UnknownTargetException;
import com.scout.pipeline.ops.model.SeedRequest;
import com.scout.pipeline.ops.model.SeedResult;
import com.scout.pipeline.ops.service.OperationalControlService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/crawl")
public class CrawlController {
    private final CrawlQueueService queueService;
    private final RecrawlService recrawlService;
    private final DomainAdmissionService admissionService;
    private final OperationalControlService controlService;
    private final PipelineProperties properties;

    public CrawlController(
        CrawlQueueService queueService,
        RecrawlService recrawlService,
        DomainAdmissionService admissionService,
        OperationalControlService controlService,
        PipelineProperties properties
    ) {
        this.queueService = queueService;
        this.recrawlService = recrawlService;
        this.admissionService = admissionService;
        this.controlService = controlService;
        this.properties = properties;
    }

    @PostMapping("/seed")
    public SeedResult seed(@RequestBody SeedRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "seed request body is required");
        }
        return controlService.enqueueSeed(request.source(), request.urls(), request.priority());
    }

    @PostMapping("/jobs")
    public EnqueueResult enqueue(@RequestBody EnqueueJobRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "job request body is required");
        }
        int priority = request.priority() == null ? properties.getQueue().getDefaultPriority() : request.priority();
        int depth = request.depth() == null ? 0 : Math.max(0, request.depth());
        return queueService.enqueue(request.source(), request.resource(), priority, request.parentResource(), depth);
    }

    @GetMapping("/jobs/{jobId}")
    public CrawlJob job(@PathVariable("jobId") long jobId) {
        return queueService.findJob(jobId)
            .orElseThrow(() -> new UnknownTargetException("Unknown crawl job " + jobId));
    }

    @GetMapping("/jobs/inspect")
    public ResourceInspection inspect(
        @RequestParam(name = "source") String source,
        @RequestParam(name = "resource") String resource
    ) {
        return controlService.inspect(source, resource);
    }

    @GetMapping("/pressure")
    public List<DomainPressure> pressure() {
        return controlService.queuePressure();
    }

    @GetMapping("/domains")
    public List<DomainState> domains() {
        return admissionService.findAll();
    }

    @PostMapping("/recrawl")
    public RecrawlSummary recrawl() {
        return recrawlService.scheduleRecrawl();
    }
}
