package com.scout.pipeline.ingest.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.pipeline.crawl.service.PermanentProcessingException;
import com.scout.pipeline.ingest.model.FileType;
import com.scout.pipeline.ingest.model.HandlerResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Accepts a top-level array, a single object, or newline-delimited objects.
 */
@Component
public class JsonFileHandler implements FileFormatHandler {
    private final ObjectMapper objectMapper;

    public JsonFileHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public FileType type() {
        return FileType.JSON;
    }

    @Override
    public HandlerResult handle(String sourceFile, InputStream content, RawEventSink sink) throws IOException {
        int processed = 0;
        int failed = 0;
        int index = 0;
        String errorDetail = null;
        try (MappingIterator<JsonNode> values = objectMapper.readerFor(JsonNode.class).readValues(content)) {
            while (values.hasNextValue()) {
                JsonNode value = values.nextValue();
                if (value.isArray()) {
                    for (JsonNode element : value) {
                        if (landNode(sourceFile, index++, element, sink)) {
                            processed++;
                        } else {
                            failed++;
                        }
                    }
                } else if (landNode(sourceFile, index++, value, sink)) {
                    processed++;
                } else {
                    failed++;
                }
            }
        } catch (JsonProcessingException e) {
            if (processed == 0 && failed == 0) {
                throw new PermanentProcessingException("malformed JSON in " + sourceFile + ": " + e.getOriginalMessage(), e);
            }
            failed++;
            errorDetail = "truncated at entry " + index + ": " + e.getOriginalMessage();
        }
        if (processed == 0 && failed == 0) {
            throw new PermanentProcessingException("no JSON records in " + sourceFile);
        }
        return new HandlerResult(processed, failed, errorDetail);
    }

    private boolean landNode(String sourceFile, int index, JsonNode node, RawEventSink sink) throws JsonProcessingException {
        if (node == null || !node.isObject()) {
            return false;
        }
        sink.land(sourceFile, "row-" + index, objectMapper.writeValueAsString(node));
        return true;
    }
}
