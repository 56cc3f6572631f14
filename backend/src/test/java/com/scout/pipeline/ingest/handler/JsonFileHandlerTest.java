package com.scout.pipeline.ingest.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.pipeline.crawl.service.PermanentProcessingException;
import com.scout.pipeline.ingest.model.HandlerResult;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileHandlerTest {
    private final JsonFileHandler handler = new JsonFileHandler(new ObjectMapper());

    @Test
    void landsEveryObjectOfATopLevelArray() throws Exception {
        RecordingSink sink = new RecordingSink();

        HandlerResult result = handler.handle("bucket/a.json", stream("""
            [{"txn_id": "t1", "amount": 10}, {"txn_id": "t2", "amount": 20}, 42]
            """), sink);

        assertThat(result.recordsProcessed()).isEqualTo(2);
        assertThat(result.recordsFailed()).isEqualTo(1);
        assertThat(sink.landed).extracting(RecordingSink.Landed::entryName).containsExactly("row-0", "row-1");
        assertThat(sink.landed.get(0).payload()).contains("\"txn_id\":\"t1\"");
    }

    @Test
    void acceptsNewlineDelimitedObjects() throws Exception {
        RecordingSink sink = new RecordingSink();

        HandlerResult result = handler.handle("bucket/b.ndjson", stream("""
            {"txn_id": "t1"}
            {"txn_id": "t2"}
            {"txn_id": "t3"}
            """), sink);

        assertThat(result.recordsProcessed()).isEqualTo(3);
        assertThat(result.errorDetail()).isNull();
    }

    @Test
    void truncatedTailIsCountedNotFatal() throws Exception {
        RecordingSink sink = new RecordingSink();

        HandlerResult result = handler.handle("bucket/c.ndjson", stream("{\"txn_id\": \"t1\"}\n{\"txn_id\": "), sink);

        assertThat(result.recordsProcessed()).isEqualTo(1);
        assertThat(result.recordsFailed()).isEqualTo(1);
        assertThat(result.errorDetail()).startsWith("truncated at entry");
    }

    @Test
    void unreadableFileIsPermanent() {
        assertThatThrownBy(() -> handler.handle("bucket/d.json", stream("not json at all"), new RecordingSink()))
            .isInstanceOf(PermanentProcessingException.class)
            .hasMessageContaining("malformed JSON");
        assertThatThrownBy(() -> handler.handle("bucket/e.json", stream("   "), new RecordingSink()))
            .isInstanceOf(PermanentProcessingException.class);
    }

    private static ByteArrayInputStream stream(String body) {
        return new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8));
    }
}
