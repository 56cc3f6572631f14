package com.scout.pipeline.ops.api;

import com.scout.pipeline.crawl.model.DomainState;
import com.scout.pipeline.crawl.service.DomainAdmissionService;
import com.scout.pipeline.crawl.service.UnknownTargetException;
import com.scout.pipeline.ops.model.EmergencyStopResult;
import com.scout.pipeline.ops.model.PipelineHealth;
import com.scout.pipeline.ops.model.QuarantineResult;
import com.scout.pipeline.ops.model.ReleaseRequest;
import com.scout.pipeline.ops.model.ReleaseResult;
import com.scout.pipeline.ops.model.RetentionResult;
import com.scout.pipeline.ops.model.SweepResult;
import com.scout.pipeline.ops.service.OperationalControlService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/ops")
public class OpsController {
    private final OperationalControlService controlService;
    private final DomainAdmissionService admissionService;

    public OpsController(OperationalControlService controlService, DomainAdmissionService admissionService) {
        this.controlService = controlService;
        this.admissionService = admissionService;
    }

    @PostMapping("/domains/{domain}/throttle")
    public DomainState throttle(
        @PathVariable("domain") String domain,
        @RequestParam(name = "spacingMs") long spacingMs
    ) {
        controlService.throttleDomain(domain, spacingMs);
        return admissionService.find(domain)
            .orElseThrow(() -> new UnknownTargetException("Unknown domain " + domain));
    }

    @PostMapping("/sources/{sourceId}/quarantine")
    public QuarantineResult quarantine(
        @PathVariable("sourceId") String sourceId,
        @RequestParam(name = "reason", required = false) String reason
    ) {
        return controlService.quarantineSource(sourceId, reason);
    }

    @PostMapping("/quarantine/release")
    public ReleaseResult release(@RequestBody ReleaseRequest request) {
        return controlService.releaseQuarantine(request);
    }

    @PostMapping("/emergency-stop")
    public EmergencyStopResult emergencyStop() {
        return controlService.emergencyStop();
    }

    @PostMapping("/retry-failed")
    public Map<String, Object> retryFailed(@RequestParam(name = "resource", required = false) String resource) {
        int reset = controlService.retryFailed(resource);
        return Map.of("reset", reset);
    }

    @PostMapping("/sweep")
    public SweepResult sweep() {
        return controlService.sweepStaleLeases();
    }

    @PostMapping("/retention")
    public RetentionResult retention() {
        return controlService.purgeExpired();
    }

    @GetMapping("/health")
    public PipelineHealth health() {
        return controlService.health();
    }
}
