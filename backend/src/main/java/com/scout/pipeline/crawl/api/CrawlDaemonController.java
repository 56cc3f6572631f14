package com.scout.pipeline.crawl.api;

import com.scout.pipeline.crawl.model.CrawlDaemonStatus;
import com.scout.pipeline.crawl.service.CrawlWorkerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/daemon")
public class CrawlDaemonController {
    private final CrawlWorkerService workerService;

    public CrawlDaemonController(CrawlWorkerService workerService) {
        this.workerService = workerService;
    }

    @PostMapping("/start")
    public CrawlDaemonStatus start() {
        workerService.start();
        return workerService.getStatus();
    }

    @PostMapping("/stop")
    public CrawlDaemonStatus stop() {
        workerService.stop();
        return workerService.getStatus();
    }

    @GetMapping("/status")
    public CrawlDaemonStatus status() {
        return workerService.getStatus();
    }
}
