package com.scout.pipeline.ingest.model;

public record StoredObject(
    String bucket,
    String path,
    long sizeBytes,
    String mimeType
) {
    public String contentRef() {
        return bucket + "/" + path;
    }
}
