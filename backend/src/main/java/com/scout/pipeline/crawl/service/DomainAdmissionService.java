package com.scout.pipeline.crawl.service;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.model.DomainState;
import com.scout.pipeline.crawl.persistence.DomainStateRepository;
import com.scout.pipeline.crawl.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-domain spacing gate consulted before a claim. The check reads {@code last_fetch_at} and the
 * claim writes it afterwards with no lock in between, so two workers claiming for the same domain at
 * the same moment can both be admitted. Callers treat this as a soft limit.
 */
@Service
public class DomainAdmissionService {
    private static final Logger log = LoggerFactory.getLogger(DomainAdmissionService.class);

    private final DomainStateRepository repository;
    private final PipelineProperties properties;

    public DomainAdmissionService(DomainStateRepository repository, PipelineProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    public boolean admits(String domain, Instant now) {
        String normalized = UrlUtils.normalizeDomain(domain);
        if (normalized == null) {
            return true;
        }
        Optional<DomainState> state = repository.find(normalized);
        if (state.isEmpty() || state.get().lastFetchAt() == null) {
            return true;
        }
        Instant nextAdmissible = state.get().nextAdmissibleAt();
        return !nextAdmissible.isAfter(now);
    }

    public Instant nextAdmissibleAt(String domain) {
        String normalized = UrlUtils.normalizeDomain(domain);
        if (normalized == null) {
            return null;
        }
        return repository.find(normalized).map(DomainState::nextAdmissibleAt).orElse(null);
    }

    public void ensureDomain(String domain, Instant now) {
        String normalized = UrlUtils.normalizeDomain(domain);
        if (normalized == null) {
            return;
        }
        if (repository.insertIfAbsent(normalized, properties.getAdmission().getDefaultMinSpacingMs(), now)) {
            log.debug("Registered domain {} with spacing {}ms", normalized, properties.getAdmission().getDefaultMinSpacingMs());
        }
    }

    public void recordClaim(String domain, Instant now) {
        String normalized = UrlUtils.normalizeDomain(domain);
        if (normalized == null) {
            return;
        }
        repository.recordClaim(normalized, properties.getAdmission().getDefaultMinSpacingMs(), now);
    }

    public void recordRelease(String domain, Instant now) {
        String normalized = UrlUtils.normalizeDomain(domain);
        if (normalized == null) {
            return;
        }
        repository.recordRelease(normalized, now);
    }

    public void throttle(String domain, long minSpacingMs, Instant now) {
        String normalized = UrlUtils.normalizeDomain(domain);
        if (normalized == null) {
            throw new IllegalArgumentException("domain is required");
        }
        if (minSpacingMs < 0) {
            throw new IllegalArgumentException("spacingMs must be >= 0");
        }
        repository.upsertSpacing(normalized, minSpacingMs, now);
        log.info("Domain {} spacing set to {}ms", normalized, minSpacingMs);
    }

    public int raiseAllSpacing(long minSpacingMs, Instant now) {
        return repository.raiseAllSpacing(minSpacingMs, now);
    }

    public Optional<DomainState> find(String domain) {
        String normalized = UrlUtils.normalizeDomain(domain);
        return normalized == null ? Optional.empty() : repository.find(normalized);
    }

    public List<DomainState> findAll() {
        return repository.findAll();
    }
}
