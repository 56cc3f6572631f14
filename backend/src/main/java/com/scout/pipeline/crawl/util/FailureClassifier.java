package com.scout.pipeline.crawl.util;

import com.scout.pipeline.crawl.model.FailureKind;
import com.scout.pipeline.crawl.service.PermanentProcessingException;
import com.scout.pipeline.crawl.service.TransientProcessingException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

public final class FailureClassifier {
  private static final int MAX_MESSAGE_LENGTH = 1000;

  private FailureClassifier() {}

  public static FailureKind fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return FailureKind.TRANSIENT;
    }
    if (status == 408 || status == 429) {
      return FailureKind.TRANSIENT;
    }
    if (status >= 500 && status < 600) {
      return FailureKind.TRANSIENT;
    }
    if (status >= 400 && status < 500) {
      return FailureKind.PERMANENT;
    }
    return FailureKind.TRANSIENT;
  }

  public static RuntimeException toProcessingException(int status, String resource) {
    String message = "http_" + status + " for " + resource;
    if (fromHttpStatus(status) == FailureKind.PERMANENT) {
      return new PermanentProcessingException(message, status, null);
    }
    return new TransientProcessingException(message, status, null);
  }

  /**
   * Unknown failures are treated as transient; they spend retry budget and end in quarantine.
   */
  public static FailureKind classify(Throwable error) {
    if (error == null) {
      return FailureKind.TRANSIENT;
    }
    if (error instanceof PermanentProcessingException) {
      return FailureKind.PERMANENT;
    }
    if (error instanceof TransientProcessingException) {
      return FailureKind.TRANSIENT;
    }
    if (error instanceof HttpTimeoutException
        || error instanceof TimeoutException
        || error instanceof IOException
        || error instanceof UncheckedIOException) {
      return FailureKind.TRANSIENT;
    }
    if (error.getCause() != null && error.getCause() != error) {
      FailureKind nested = classifyCause(error.getCause());
      if (nested != null) {
        return nested;
      }
    }
    return FailureKind.TRANSIENT;
  }

  public static Integer httpStatusOf(Throwable error) {
    if (error instanceof PermanentProcessingException permanent) {
      return permanent.getHttpStatus();
    }
    if (error instanceof TransientProcessingException transientError) {
      return transientError.getHttpStatus();
    }
    return null;
  }

  public static String describe(Throwable error) {
    if (error == null) {
      return "unknown_error";
    }
    String message = error.getMessage();
    String summary = error.getClass().getSimpleName()
        + (message == null || message.isBlank() ? "" : ": " + message.trim());
    return truncate(summary);
  }

  public static String truncate(String value) {
    if (value == null) {
      return null;
    }
    return value.length() > MAX_MESSAGE_LENGTH ? value.substring(0, MAX_MESSAGE_LENGTH) : value;
  }

  public static boolean isRetryable(FailureKind kind) {
    return kind == FailureKind.TRANSIENT;
  }

  private static FailureKind classifyCause(Throwable cause) {
    if (cause instanceof PermanentProcessingException) {
      return FailureKind.PERMANENT;
    }
    String name = cause.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    if (name.contains("timeout") || cause instanceof IOException) {
      return FailureKind.TRANSIENT;
    }
    return null;
  }
}
