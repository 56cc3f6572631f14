package com.scout.pipeline.ingest.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.pipeline.config.PipelineProperties;
import com.scout.pipeline.crawl.service.PermanentProcessingException;
import com.scout.pipeline.ingest.model.HandlerResult;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZipFileHandlerTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ZipFileHandler handler = new ZipFileHandler(
        new JsonFileHandler(objectMapper),
        new CsvFileHandler(objectMapper),
        new PipelineProperties()
    );

    @Test
    void entriesAreDelegatedByExtension() throws Exception {
        byte[] archive = zip(
            "day1/events.json", "[{\"txn_id\": \"a\"}, {\"txn_id\": \"b\"}]",
            "day1/sales.csv", "txn_id,amount\nc,1.00\n",
            "readme.txt", "ignore me"
        );
        RecordingSink sink = new RecordingSink();

        HandlerResult result = handler.handle("bucket/batch.zip", new ByteArrayInputStream(archive), sink);

        assertThat(result.recordsProcessed()).isEqualTo(3);
        assertThat(result.recordsFailed()).isEqualTo(1);
        assertThat(result.errorDetail()).contains("unsupported entry readme.txt");
        assertThat(sink.landed).extracting(RecordingSink.Landed::sourceFile)
            .containsExactly("bucket/batch.zip!day1/events.json", "bucket/batch.zip!day1/events.json", "bucket/batch.zip!day1/sales.csv");
    }

    @Test
    void brokenEntryDoesNotFailTheArchive() throws Exception {
        byte[] archive = zip(
            "good.json", "{\"txn_id\": \"a\"}",
            "bad.json", "{{{"
        );

        HandlerResult result = handler.handle("bucket/mixed.zip", new ByteArrayInputStream(archive), new RecordingSink());

        assertThat(result.recordsProcessed()).isEqualTo(1);
        assertThat(result.recordsFailed()).isEqualTo(1);
    }

    @Test
    void archiveWithoutReadableEntriesIsPermanent() throws Exception {
        byte[] onlyText = zip("notes.txt", "hello");

        assertThatThrownBy(() -> handler.handle("bucket/notes.zip", new ByteArrayInputStream(onlyText), new RecordingSink()))
            .isInstanceOf(PermanentProcessingException.class)
            .hasMessageContaining("no readable entries");
        assertThatThrownBy(() -> handler.handle("bucket/junk.zip",
            new ByteArrayInputStream("not a zip".getBytes(StandardCharsets.UTF_8)), new RecordingSink()))
            .isInstanceOf(PermanentProcessingException.class);
    }

    @Test
    void highlyCompressedEntryIsCappedAtTheFileSizeLimit() throws Exception {
        PipelineProperties properties = new PipelineProperties();
        properties.getIntake().setMaxFileBytes(4096);
        ZipFileHandler capped = new ZipFileHandler(
            new JsonFileHandler(objectMapper),
            new CsvFileHandler(objectMapper),
            properties
        );
        byte[] bomb = zip("huge.json", "[" + " ".repeat(1_000_000) + "]");

        assertThat(bomb.length).isLessThan(4096);
        assertThatThrownBy(() -> capped.handle("bucket/bomb.zip", new ByteArrayInputStream(bomb), new RecordingSink()))
            .isInstanceOf(PermanentProcessingException.class)
            .hasMessageContaining("expands beyond 4096 bytes");
    }

    @Test
    void archiveTotalIsCappedAcrossEntries() throws Exception {
        PipelineProperties properties = new PipelineProperties();
        properties.getIntake().setMaxFileBytes(4096);
        ZipFileHandler capped = new ZipFileHandler(
            new JsonFileHandler(objectMapper),
            new CsvFileHandler(objectMapper),
            properties
        );
        String padded = "{\"txn_id\": \"a\"}" + " ".repeat(3000);
        byte[] archive = zip("first.json", padded, "second.json", padded);

        assertThatThrownBy(() -> capped.handle("bucket/pair.zip", new ByteArrayInputStream(archive), new RecordingSink()))
            .isInstanceOf(PermanentProcessingException.class)
            .hasMessageContaining("at entry second.json");
    }

    private static byte[] zip(String... namesAndBodies) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (int i = 0; i < namesAndBodies.length; i += 2) {
                zip.putNextEntry(new ZipEntry(namesAndBodies[i]));
                zip.write(namesAndBodies[i + 1].getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return bytes.toByteArray();
    }
}
