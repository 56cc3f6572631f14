package com.scout.pipeline.ingest.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scout.pipeline.crawl.service.PermanentProcessingException;
import com.scout.pipeline.ingest.model.FileType;
import com.scout.pipeline.ingest.model.HandlerResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Header-first CSV. Each data row lands as a JSON object keyed by header name.
 */
@Component
public class CsvFileHandler implements FileFormatHandler {
    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .setIgnoreSurroundingSpaces(true)
        .setTrim(true)
        .build();

    private final ObjectMapper objectMapper;

    public CsvFileHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public FileType type() {
        return FileType.CSV;
    }

    @Override
    public HandlerResult handle(String sourceFile, InputStream content, RawEventSink sink) throws IOException {
        Reader reader = new InputStreamReader(content, StandardCharsets.UTF_8);
        int processed = 0;
        int failed = 0;
        try (CSVParser parser = FORMAT.parse(reader)) {
            List<String> headers = parser.getHeaderNames();
            if (headers == null || headers.isEmpty()) {
                throw new PermanentProcessingException("CSV without header row: " + sourceFile);
            }
            for (CSVRecord record : parser) {
                if (!record.isConsistent()) {
                    failed++;
                    continue;
                }
                ObjectNode row = objectMapper.createObjectNode();
                for (Map.Entry<String, String> column : record.toMap().entrySet()) {
                    row.put(column.getKey(), column.getValue());
                }
                sink.land(sourceFile, "row-" + record.getRecordNumber(), objectMapper.writeValueAsString(row));
                processed++;
            }
        } catch (IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            throw new PermanentProcessingException("malformed CSV in " + sourceFile + ": " + e.getMessage(), e);
        }
        String detail = failed > 0 ? failed + " rows with an unexpected column count" : null;
        return new HandlerResult(processed, failed, detail);
    }
}
