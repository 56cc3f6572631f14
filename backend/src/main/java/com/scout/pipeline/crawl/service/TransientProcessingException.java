package com.scout.pipeline.crawl.service;

/**
 * A failure worth retrying: network hiccups, throttling responses, upstream 5xx.
 */
public class TransientProcessingException extends RuntimeException {
    private final Integer httpStatus;

    public TransientProcessingException(String message) {
        this(message, null, null);
    }

    public TransientProcessingException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public TransientProcessingException(String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
