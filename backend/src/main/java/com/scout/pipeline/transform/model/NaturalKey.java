package com.scout.pipeline.transform.model;

/**
 * A record's identity in the silver layer plus the name of the field it came from.
 */
public record NaturalKey(String value, String source) {
}
