package com.scout.pipeline.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class UnknownTargetException extends RuntimeException {
    public UnknownTargetException(String message) {
        super(message);
    }
}
