package com.scout.pipeline.transform.persistence;

import com.scout.pipeline.transform.model.RawEvent;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class BronzeRepository {
    static final String ENTRY_SEPARATOR = "::";
    static final String ARCHIVE_SEPARATOR = "!";

    private static final RowMapper<RawEvent> ROW_MAPPER = (rs, rowNum) -> new RawEvent(
        rs.getLong("event_id"),
        rs.getString("object_key"),
        rs.getString("source_file"),
        rs.getString("entry_name"),
        rs.getString("txn_id"),
        rs.getString("payload"),
        toInstant(rs.getTimestamp("ingested_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public BronzeRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public static String objectKey(String sourceFile, String entryName) {
        return sourceFile + ENTRY_SEPARATOR + entryName;
    }

    /**
     * Lands one raw entry. Returns false when the same (source file, entry) was landed before.
     */
    public boolean land(String sourceFile, String entryName, String txnId, String payload, Instant now) {
        try {
            jdbc.update(
                """
                    INSERT INTO bronze_raw_events (object_key, source_file, entry_name, txn_id, payload, ingested_at)
                    VALUES (:objectKey, :sourceFile, :entryName, :txnId, :payload, :now)
                    """,
                new MapSqlParameterSource()
                    .addValue("objectKey", objectKey(sourceFile, entryName))
                    .addValue("sourceFile", sourceFile)
                    .addValue("entryName", entryName)
                    .addValue("txnId", txnId)
                    .addValue("payload", payload)
                    .addValue("now", toTimestamp(now))
            );
            return true;
        } catch (DataIntegrityViolationException e) {
            return false;
        }
    }

    /**
     * Raw events without a successful watermark, after the given event id cursor.
     */
    public List<RawEvent> findUnpromoted(long afterEventId, int limit) {
        return jdbc.query(
            """
                SELECT b.event_id, b.object_key, b.source_file, b.entry_name, b.txn_id, b.payload, b.ingested_at
                FROM bronze_raw_events b
                LEFT JOIN etl_watermarks w ON w.object_id = b.object_key AND w.ok = TRUE
                WHERE w.object_id IS NULL
                  AND b.event_id > :afterEventId
                ORDER BY b.event_id
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("afterEventId", afterEventId)
                .addValue("limit", Math.max(1, limit)),
            ROW_MAPPER
        );
    }

    public List<RawEvent> findBySourceFile(String sourceFile) {
        return jdbc.query(
            """
                SELECT event_id, object_key, source_file, entry_name, txn_id, payload, ingested_at
                FROM bronze_raw_events
                WHERE source_file = :sourceFile
                ORDER BY event_id
                """,
            new MapSqlParameterSource().addValue("sourceFile", sourceFile),
            ROW_MAPPER
        );
    }

    public long count() {
        Long value = jdbc.queryForObject("SELECT COUNT(*) FROM bronze_raw_events", new MapSqlParameterSource(), Long.class);
        return value == null ? 0L : value;
    }

    public Instant latestIngestedAt() {
        Timestamp value = jdbc.queryForObject(
            "SELECT MAX(ingested_at) FROM bronze_raw_events",
            new MapSqlParameterSource(),
            Timestamp.class
        );
        return toInstant(value);
    }

    /**
     * Counts events landed from a file, including entries of an archive stored as {@code file!entry}.
     */
    public long countBySourceFilePrefix(String sourceFile) {
        String archivePrefix = sourceFile + ARCHIVE_SEPARATOR;
        Long value = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM bronze_raw_events
                WHERE source_file = :sourceFile
                   OR SUBSTRING(source_file, 1, :prefixLength) = :archivePrefix
                """,
            new MapSqlParameterSource()
                .addValue("sourceFile", sourceFile)
                .addValue("archivePrefix", archivePrefix)
                .addValue("prefixLength", archivePrefix.length()),
            Long.class
        );
        return value == null ? 0L : value;
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp value) {
        return value == null ? null : value.toInstant();
    }
}
