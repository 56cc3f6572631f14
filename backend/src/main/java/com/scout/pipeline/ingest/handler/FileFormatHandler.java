package com.scout.pipeline.ingest.handler;

import com.scout.pipeline.ingest.model.FileType;
import com.scout.pipeline.ingest.model.HandlerResult;

import java.io.IOException;
import java.io.InputStream;

public interface FileFormatHandler {
    FileType type();

    /**
     * Parses the content and lands every entry through the sink. Malformed content that cannot be
     * read at all is reported with {@link com.scout.pipeline.crawl.service.PermanentProcessingException};
     * per-entry problems are counted in {@link HandlerResult#recordsFailed()}.
     */
    HandlerResult handle(String sourceFile, InputStream content, RawEventSink sink) throws IOException;
}
