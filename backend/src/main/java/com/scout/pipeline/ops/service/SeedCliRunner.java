package com.scout.pipeline.ops.service;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.ops.model.SeedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Seeds a source from {@code pipeline.cli.seed-source} and the comma-separated
 * {@code pipeline.cli.seed-urls} at startup.
 */
@Component
public class SeedCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SeedCliRunner.class);

    private final PipelineProperties properties;
    private final OperationalControlService controlService;

    public SeedCliRunner(PipelineProperties properties, OperationalControlService controlService) {
        this.properties = properties;
        this.controlService = controlService;
    }

    @Override
    public void run(ApplicationArguments args) {
        String source = properties.getCli().getSeedSource();
        if (source == null || source.isBlank()) {
            return;
        }
        List<String> urls = Arrays.stream(properties.getCli().getSeedUrls().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
        if (urls.isEmpty()) {
            log.warn("pipeline.cli.seed-source is set but no seed urls were given");
            return;
        }
        SeedResult result = controlService.enqueueSeed(source, urls, null);
        log.info("CLI seed {}: created={} existing={} rejected={}",
            result.source(), result.created(), result.existing(), result.rejected());
    }
}
