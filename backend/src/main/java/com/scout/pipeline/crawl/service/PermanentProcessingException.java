package com.scout.pipeline.crawl.service;

/**
 * A failure that will not go away on retry: malformed payload, unsupported type, 4xx responses.
 */
public class PermanentProcessingException extends RuntimeException {
    private final Integer httpStatus;

    public PermanentProcessingException(String message) {
        this(message, null, null);
    }

    public PermanentProcessingException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public PermanentProcessingException(String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
