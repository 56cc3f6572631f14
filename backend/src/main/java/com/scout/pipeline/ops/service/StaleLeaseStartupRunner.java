package com.scout.pipeline.ops.service;

import com.scout.pipeline.ops.model.SweepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Sweeps leases left behind by a previous process before workers start claiming.
 */
@Component
public class StaleLeaseStartupRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StaleLeaseStartupRunner.class);

    private final LeaseSweepService leaseSweepService;

    public StaleLeaseStartupRunner(LeaseSweepService leaseSweepService) {
        this.leaseSweepService = leaseSweepService;
    }

    @Override
    public void run(ApplicationArguments args) {
        SweepResult result;
        try {
            result = leaseSweepService.sweep();
        } catch (Exception e) {
            log.warn("Skipping startup lease sweep because the database is unreachable", e);
            return;
        }
        if (result.crawlRequeued() > 0 || result.intakeRequeued() > 0) {
            log.info("Startup sweep requeued {} crawl jobs and {} intake records", result.crawlRequeued(), result.intakeRequeued());
        }
    }
}
