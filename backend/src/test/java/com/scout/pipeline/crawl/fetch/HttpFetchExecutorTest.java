package com.scout.pipeline.crawl.fetch;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.model.FetchOutcome;
import com.scout.pipeline.crawl.model.FetchRequest;
import com.scout.pipeline.crawl.model.PageCacheEntry;
import com.scout.pipeline.crawl.model.ParseStatus;
import com.scout.pipeline.crawl.service.PermanentProcessingException;
import com.scout.pipeline.crawl.service.TransientProcessingException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpFetchExecutorTest {
    private MockWebServer server;
    private ExecutorService executor;
    private HttpFetchExecutor fetchExecutor;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        PipelineProperties properties = new PipelineProperties();
        properties.setRequestTimeoutSeconds(5);
        fetchExecutor = new HttpFetchExecutor(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void htmlPageYieldsSameHostLinksAndFingerprint() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/html; charset=utf-8")
            .setHeader("ETag", "\"v1\"")
            .setBody("""
                <html><body>
                  <a href="/products/1">one</a>
                  <a href="/products/1#reviews">one again</a>
                  <a href="https://elsewhere.example.org/x">offsite</a>
                </body></html>
                """));
        String url = server.url("/catalog").toString();

        FetchOutcome outcome = fetchExecutor.fetch(new FetchRequest("shop", url, null));

        assertThat(outcome.httpStatus()).isEqualTo(200);
        assertThat(outcome.parseStatus()).isEqualTo(ParseStatus.OK);
        assertThat(outcome.etag()).isEqualTo("\"v1\"");
        assertThat(outcome.contentSha256()).hasSize(64);
        assertThat(outcome.discovered()).containsExactly(server.url("/products/1").toString());
    }

    @Test
    void sendsConditionalHeadersAndHandlesNotModified() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(304));
        String url = server.url("/catalog").toString();
        PageCacheEntry prior = new PageCacheEntry("shop", url, 200, "\"v1\"", "Mon, 02 Mar 2026 10:00:00 GMT",
            "abc123", Instant.now(), ParseStatus.OK, null);

        FetchOutcome outcome = fetchExecutor.fetch(new FetchRequest("shop", url, prior));

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getHeader("If-None-Match")).isEqualTo("\"v1\"");
        assertThat(recorded.getHeader("If-Modified-Since")).isEqualTo("Mon, 02 Mar 2026 10:00:00 GMT");
        assertThat(recorded.getHeader("User-Agent")).startsWith("scout-pipeline/");
        assertThat(outcome.parseStatus()).isEqualTo(ParseStatus.NOT_MODIFIED);
        assertThat(outcome.contentSha256()).isEqualTo("abc123");
        assertThat(outcome.discovered()).isEmpty();
    }

    @Test
    void unchangedBodyIsReportedAsNotModified() {
        server.enqueue(new MockResponse().setResponseCode(200).setHeader("Content-Type", "text/html").setBody("<p>same</p>"));
        server.enqueue(new MockResponse().setResponseCode(200).setHeader("Content-Type", "text/html").setBody("<p>same</p>"));
        String url = server.url("/same").toString();

        FetchOutcome first = fetchExecutor.fetch(new FetchRequest("shop", url, null));
        PageCacheEntry prior = new PageCacheEntry("shop", url, 200, null, null, first.contentSha256(),
            Instant.now(), ParseStatus.OK, null);
        FetchOutcome second = fetchExecutor.fetch(new FetchRequest("shop", url, prior));

        assertThat(second.parseStatus()).isEqualTo(ParseStatus.NOT_MODIFIED);
        assertThat(second.parseNote()).isEqualTo("fingerprint_unchanged");
    }

    @Test
    void nonHtmlContentIsSkipped() {
        server.enqueue(new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/pdf").setBody("%PDF"));

        FetchOutcome outcome = fetchExecutor.fetch(new FetchRequest("shop", server.url("/doc.pdf").toString(), null));

        assertThat(outcome.parseStatus()).isEqualTo(ParseStatus.SKIPPED);
    }

    @Test
    void clientErrorsArePermanentAndServerErrorsTransient() {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(503));
        String url = server.url("/gone").toString();

        assertThatThrownBy(() -> fetchExecutor.fetch(new FetchRequest("shop", url, null)))
            .isInstanceOf(PermanentProcessingException.class)
            .hasMessageContaining("http_404");
        assertThatThrownBy(() -> fetchExecutor.fetch(new FetchRequest("shop", url, null)))
            .isInstanceOf(TransientProcessingException.class)
            .hasMessageContaining("http_503");
    }

    @Test
    void invalidResourceIsPermanent() {
        assertThatThrownBy(() -> fetchExecutor.fetch(new FetchRequest("shop", "mailto:someone@example.com", null)))
            .isInstanceOf(PermanentProcessingException.class);
    }
}
