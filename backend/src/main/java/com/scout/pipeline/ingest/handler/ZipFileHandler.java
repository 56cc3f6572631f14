package com.scout.pipeline.ingest.handler;

import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.service.PermanentProcessingException;
import com.scout.pipeline.ingest.model.FileType;
import com.scout.pipeline.ingest.model.HandlerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Unpacks an archive and hands each JSON or CSV entry to the matching handler. Nested archives and
 * unknown entry types are counted as failed entries rather than failing the whole file. The
 * uncompressed total is capped at the intake file size limit.
 */
@Component
public class ZipFileHandler implements FileFormatHandler {
    private static final Logger log = LoggerFactory.getLogger(ZipFileHandler.class);

    private static final int MAX_ARRAY_BYTES = Integer.MAX_VALUE - 8;

    private final JsonFileHandler jsonHandler;
    private final CsvFileHandler csvHandler;
    private final PipelineProperties properties;

    public ZipFileHandler(JsonFileHandler jsonHandler, CsvFileHandler csvHandler, PipelineProperties properties) {
        this.jsonHandler = jsonHandler;
        this.csvHandler = csvHandler;
        this.properties = properties;
    }

    @Override
    public FileType type() {
        return FileType.ZIP;
    }

    @Override
    public HandlerResult handle(String sourceFile, InputStream content, RawEventSink sink) throws IOException {
        HandlerResult total = new HandlerResult(0, 0, null);
        long limit = properties.getIntake().getMaxFileBytes();
        long expanded = 0;
        int entries = 0;
        try (ZipInputStream zip = new ZipInputStream(content)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                entries++;
                String entryName = entry.getName();
                Optional<FileType> entryType = FileType.detect(entryName, null);
                if (entryType.isEmpty() || entryType.get() == FileType.ZIP) {
                    log.debug("Skipping unsupported archive entry {} in {}", entryName, sourceFile);
                    total = total.plus(new HandlerResult(0, 1, "unsupported entry " + entryName));
                    continue;
                }
                byte[] bytes = readBounded(zip, limit - expanded);
                if (bytes == null) {
                    throw new PermanentProcessingException("archive " + sourceFile + " expands beyond "
                        + limit + " bytes at entry " + entryName);
                }
                expanded += bytes.length;
                FileFormatHandler delegate = entryType.get() == FileType.JSON ? jsonHandler : csvHandler;
                try {
                    total = total.plus(delegate.handle(sourceFile + "!" + entryName, new ByteArrayInputStream(bytes), sink));
                } catch (PermanentProcessingException e) {
                    total = total.plus(new HandlerResult(0, 1, e.getMessage()));
                }
            }
        } catch (ZipException e) {
            throw new PermanentProcessingException("corrupt archive " + sourceFile + ": " + e.getMessage(), e);
        }
        if (entries == 0) {
            throw new PermanentProcessingException("empty or unreadable archive " + sourceFile);
        }
        if (total.recordsProcessed() == 0) {
            throw new PermanentProcessingException("no readable entries in " + sourceFile + ": " + total.errorDetail());
        }
        return total;
    }

    /**
     * Reads the current entry, or returns null when it holds more than {@code remaining} bytes.
     */
    private static byte[] readBounded(InputStream entry, long remaining) throws IOException {
        int cap = (int) Math.min(Math.max(0, remaining), MAX_ARRAY_BYTES - 1);
        byte[] bytes = entry.readNBytes(cap + 1);
        return bytes.length > cap ? null : bytes;
    }
}
