package com.scout.pipeline.ingest.storage;

import com.scout.pipeline.ingest.model.StoredObject;

import java.io.IOException;
import java.io.InputStream;

/**
 * Bucket/path addressed blob storage. Every successful {@link #putObject} announces itself with an
 * {@link com.scout.pipeline.ingest.model.ObjectCreatedEvent}.
 */
public interface ObjectStore {
    StoredObject putObject(String bucket, String path, byte[] content, String mimeType) throws IOException;

    /**
     * Opens the object for reading. Throws {@link java.nio.file.NoSuchFileException} when it does not exist.
     */
    InputStream openObject(String bucket, String path) throws IOException;

    boolean exists(String bucket, String path);
}
