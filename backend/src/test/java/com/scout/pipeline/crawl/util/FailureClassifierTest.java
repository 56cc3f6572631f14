package com.scout.pipeline.crawl.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.scout.pipeline.crawl.model.FailureKind;
import com.scout.pipeline.crawl.service.PermanentProcessingException;
import com.scout.pipeline.crawl.service.TransientProcessingException;
import java.io.IOException;
import java.net.http.HttpTimeoutException;
import org.junit.jupiter.api.Test;

class FailureClassifierTest {

  @Test
  void mapsHttpStatusesToFailureKinds() {
    assertThat(FailureClassifier.fromHttpStatus(404)).isEqualTo(FailureKind.PERMANENT);
    assertThat(FailureClassifier.fromHttpStatus(410)).isEqualTo(FailureKind.PERMANENT);
    assertThat(FailureClassifier.fromHttpStatus(408)).isEqualTo(FailureKind.TRANSIENT);
    assertThat(FailureClassifier.fromHttpStatus(429)).isEqualTo(FailureKind.TRANSIENT);
    assertThat(FailureClassifier.fromHttpStatus(503)).isEqualTo(FailureKind.TRANSIENT);
    assertThat(FailureClassifier.fromHttpStatus(null)).isEqualTo(FailureKind.TRANSIENT);
  }

  @Test
  void buildsExceptionCarryingTheStatus() {
    RuntimeException notFound = FailureClassifier.toProcessingException(404, "https://a.example/x");
    RuntimeException unavailable = FailureClassifier.toProcessingException(503, "https://a.example/x");

    assertThat(notFound).isInstanceOf(PermanentProcessingException.class).hasMessageContaining("http_404");
    assertThat(unavailable).isInstanceOf(TransientProcessingException.class);
    assertThat(FailureClassifier.httpStatusOf(unavailable)).isEqualTo(503);
  }

  @Test
  void classifiesIoAndTimeoutsAsTransient() {
    assertThat(FailureClassifier.classify(new IOException("reset"))).isEqualTo(FailureKind.TRANSIENT);
    assertThat(FailureClassifier.classify(new HttpTimeoutException("slow"))).isEqualTo(FailureKind.TRANSIENT);
  }

  @Test
  void unknownFailuresDefaultToTransient() {
    assertThat(FailureClassifier.classify(new IllegalStateException("boom"))).isEqualTo(FailureKind.TRANSIENT);
  }

  @Test
  void permanentCauseIsFound() {
    RuntimeException wrapped = new RuntimeException("outer", new PermanentProcessingException("bad csv"));
    assertThat(FailureClassifier.classify(wrapped)).isEqualTo(FailureKind.PERMANENT);
  }

  @Test
  void describeTruncatesLongMessages() {
    String description = FailureClassifier.describe(new IllegalStateException("x".repeat(5000)));
    assertThat(description).startsWith("IllegalStateException: ").hasSize(1000);
  }
}
