package com.scout.pipeline.ingest.storage;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.ingest.model.ObjectCreatedEvent;
import com.scout.pipeline.ingest.model.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Object store backed by a local directory: {@code <storage-root>/<bucket>/<path>}.
 */
@Component
public class FileSystemObjectStore implements ObjectStore {
    private static final Logger log = LoggerFactory.getLogger(FileSystemObjectStore.class);

    private final Path root;
    private final ApplicationEventPublisher eventPublisher;

    public FileSystemObjectStore(PipelineProperties properties, ApplicationEventPublisher eventPublisher) {
        this.root = Path.of(properties.getIntake().getStorageRoot()).toAbsolutePath().normalize();
        this.eventPublisher = eventPublisher;
    }

    @Override
    public StoredObject putObject(String bucket, String path, byte[] content, String mimeType) throws IOException {
        Path target = resolve(bucket, path);
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
        try {
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        StoredObject stored = new StoredObject(bucket, path, content.length, mimeType);
        log.debug("Stored object {} ({} bytes)", stored.contentRef(), content.length);
        eventPublisher.publishEvent(new ObjectCreatedEvent(bucket, path, content.length, mimeType));
        return stored;
    }

    @Override
    public InputStream openObject(String bucket, String path) throws IOException {
        return Files.newInputStream(resolve(bucket, path));
    }

    @Override
    public boolean exists(String bucket, String path) {
        try {
            return Files.isRegularFile(resolve(bucket, path));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private Path resolve(String bucket, String path) {
        if (bucket == null || bucket.isBlank() || path == null || path.isBlank()) {
            throw new IllegalArgumentException("bucket and path are required");
        }
        Path resolved = root.resolve(bucket).resolve(path).normalize();
        if (!resolved.startsWith(root.resolve(bucket).normalize())) {
            throw new IllegalArgumentException("path escapes bucket: " + path);
        }
        return resolved;
    }
}
