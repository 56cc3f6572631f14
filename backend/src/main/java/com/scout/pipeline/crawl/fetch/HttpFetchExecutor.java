package com.scout.pipeline.crawl.fetch;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.model.FetchOutcome;
import com.scout.pipeline.crawl.model.FetchRequest;
import com.scout.pipeline.crawl.model.PageCacheEntry;
import com.scout.pipeline.crawl.model.ParseStatus;
import com.scout.pipeline.crawl.service.PermanentProcessingException;
import com.scout.pipeline.crawl.service.TransientProcessingException;
import com.scout.pipeline.crawl.util.FailureClassifier;
import com.scout.pipeline.crawl.util.HashUtils;
import com.scout.pipeline.crawl.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;

@Service
public class HttpFetchExecutor implements FetchExecutor {
    private static final Logger log = LoggerFactory.getLogger(HttpFetchExecutor.class);
    private static final int MAX_DISCOVERED_LINKS = 200;

    private final PipelineProperties properties;
    private final HttpClient client;

    public HttpFetchExecutor(
        PipelineProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public FetchOutcome fetch(FetchRequest request) {
        String resource = UrlUtils.normalizeResource(request.resource());
        if (resource == null) {
            throw new PermanentProcessingException("invalid_url: " + request.resource());
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(resource))
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", PipelineProperties.normalizeUserAgent(properties.getUserAgent()))
            .header("Accept", "text/html,application/xhtml+xml,*/*;q=0.8")
            .GET();
        PageCacheEntry prior = request.prior();
        if (prior != null) {
            if (prior.etag() != null && !prior.etag().isBlank()) {
                builder.header("If-None-Match", prior.etag());
            }
            if (prior.lastModified() != null && !prior.lastModified().isBlank()) {
                builder.header("If-Modified-Since", prior.lastModified());
            }
        }

        HttpResponse<InputStream> response;
        byte[] body;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream stream = response.body()) {
                body = stream.readNBytes(properties.getMaxBodyBytes());
            }
        } catch (HttpTimeoutException e) {
            throw new TransientProcessingException("timeout fetching " + resource, e);
        } catch (IOException e) {
            throw new TransientProcessingException("io_error fetching " + resource + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientProcessingException("interrupted fetching " + resource, e);
        }

        int status = response.statusCode();
        String etag = response.headers().firstValue("ETag").orElse(null);
        String lastModified = response.headers().firstValue("Last-Modified").orElse(null);
        if (status == 304) {
            String fingerprint = prior == null ? null : prior.contentSha256();
            return new FetchOutcome(status, etag, lastModified, fingerprint, ParseStatus.NOT_MODIFIED, "not_modified", List.of());
        }
        if (status < 200 || status >= 300) {
            throw FailureClassifier.toProcessingException(status, resource);
        }

        String fingerprint = HashUtils.sha256Hex(body);
        String contentType = response.headers().firstValue("Content-Type").orElse("").toLowerCase(Locale.ROOT);
        if (prior != null && fingerprint.equals(prior.contentSha256())) {
            return new FetchOutcome(status, etag, lastModified, fingerprint, ParseStatus.NOT_MODIFIED, "fingerprint_unchanged", List.of());
        }
        if (!contentType.contains("html")) {
            return new FetchOutcome(status, etag, lastModified, fingerprint, ParseStatus.SKIPPED, "content_type=" + contentType, List.of());
        }
        String html = new String(body, StandardCharsets.UTF_8);
        List<String> discovered = LinkExtractor.sameHostLinks(html, resource, MAX_DISCOVERED_LINKS);
        log.debug("Fetched {} status={} bytes={} links={}", resource, status, body.length, discovered.size());
        return new FetchOutcome(status, etag, lastModified, fingerprint, ParseStatus.OK, "links=" + discovered.size(), discovered);
    }
}
