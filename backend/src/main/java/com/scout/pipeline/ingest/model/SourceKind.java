package com.scout.pipeline.ingest.model;

/**
 * Where an intake record came from. Uploads are interactive and jump the queue.
 */
public enum SourceKind {
    UPLOAD,
    TRIGGER
}
