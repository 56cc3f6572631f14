package com.scout.pipeline.ingest.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.pipeline.ingest.model.HandlerResult;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class CsvFileHandlerTest {
    private final CsvFileHandler handler = new CsvFileHandler(new ObjectMapper());

    @Test
    void rowsLandAsObjectsKeyedByHeader() throws Exception {
        RecordingSink sink = new RecordingSink();
        String csv = """
            transaction_id,store_id,amount
            t-1, s-9 ,12.50
            t-2,s-9,3.00
            """;

        HandlerResult result = handler.handle("bucket/sales.csv", new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)), sink);

        assertThat(result.recordsProcessed()).isEqualTo(2);
        assertThat(result.recordsFailed()).isZero();
        assertThat(sink.landed).extracting(RecordingSink.Landed::entryName).containsExactly("row-1", "row-2");
        assertThat(sink.landed.get(0).payload())
            .isEqualTo("{\"transaction_id\":\"t-1\",\"store_id\":\"s-9\",\"amount\":\"12.50\"}");
    }

    @Test
    void rowsWithWrongColumnCountAreCounted() throws Exception {
        RecordingSink sink = new RecordingSink();
        String csv = """
            transaction_id,amount
            t-1,1.00
            t-2
            t-3,3.00
            """;

        HandlerResult result = handler.handle("bucket/short.csv", new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)), sink);

        assertThat(result.recordsProcessed()).isEqualTo(2);
        assertThat(result.recordsFailed()).isEqualTo(1);
        assertThat(result.errorDetail()).contains("unexpected column count");
    }
}
