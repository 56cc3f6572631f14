package com.scout.pipeline.transform.persistence;

import com.scout.pipeline.transform.model.SilverRecord;
import com.scout.pipeline.transform.model.UpsertOutcome;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class SilverRepository {
    private static final String UPDATE_IF_NOT_OLDER = """
        UPDATE silver_records
        SET key_source = :keySource,
            source_file = :sourceFile,
            raw_event_id = :rawEventId,
            event_time = :eventTime,
            store_key = :storeKey,
            amount = :amount,
            payload = :payload,
            updated_at = :now
        WHERE natural_key = :naturalKey
          AND event_time <= :eventTime
        """;

    private static final RowMapper<SilverRecord> ROW_MAPPER = (rs, rowNum) -> new SilverRecord(
        rs.getString("natural_key"),
        rs.getString("key_source"),
        rs.getString("source_file"),
        rs.getLong("raw_event_id"),
        toInstant(rs.getTimestamp("event_time")),
        rs.getString("store_key"),
        rs.getBigDecimal("amount"),
        rs.getString("payload"),
        toInstant(rs.getTimestamp("loaded_at")),
        toInstant(rs.getTimestamp("updated_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public SilverRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Last-write-wins on event time. An incoming record older than the stored one is ignored; equal
     * event times overwrite.
     */
    public UpsertOutcome upsert(SilverRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("naturalKey", record.naturalKey())
            .addValue("keySource", record.keySource())
            .addValue("sourceFile", record.sourceFile())
            .addValue("rawEventId", record.rawEventId())
            .addValue("eventTime", toTimestamp(record.eventTime()))
            .addValue("storeKey", record.storeKey())
            .addValue("amount", record.amount())
            .addValue("payload", record.payload())
            .addValue("now", toTimestamp(record.updatedAt()));
        if (jdbc.update(UPDATE_IF_NOT_OLDER, params) > 0) {
            return UpsertOutcome.UPDATED;
        }
        if (exists(record.naturalKey())) {
            return UpsertOutcome.STALE_IGNORED;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO silver_records (
                        natural_key, key_source, source_file, raw_event_id, event_time, store_key,
                        amount, payload, loaded_at, updated_at
                    )
                    VALUES (
                        :naturalKey, :keySource, :sourceFile, :rawEventId, :eventTime, :storeKey,
                        :amount, :payload, :now, :now
                    )
                    """,
                params
            );
            return UpsertOutcome.INSERTED;
        } catch (DataIntegrityViolationException e) {
            return jdbc.update(UPDATE_IF_NOT_OLDER, params) > 0 ? UpsertOutcome.UPDATED : UpsertOutcome.STALE_IGNORED;
        }
    }

    public Optional<SilverRecord> findByKey(String naturalKey) {
        List<SilverRecord> rows = jdbc.query(
            """
                SELECT natural_key, key_source, source_file, raw_event_id, event_time, store_key,
                       amount, payload, loaded_at, updated_at
                FROM silver_records
                WHERE natural_key = :naturalKey
                """,
            new MapSqlParameterSource().addValue("naturalKey", naturalKey),
            ROW_MAPPER
        );
        return rows.stream().findFirst();
    }

    public long count() {
        Long value = jdbc.queryForObject("SELECT COUNT(*) FROM silver_records", new MapSqlParameterSource(), Long.class);
        return value == null ? 0L : value;
    }

    /**
     * Last insert or update of a silver row; an upsert that changed an existing key moves it too.
     */
    public Instant latestUpdatedAt() {
        Timestamp value = jdbc.queryForObject(
            "SELECT MAX(updated_at) FROM silver_records",
            new MapSqlParameterSource(),
            Timestamp.class
        );
        return toInstant(value);
    }

    public long countBySourceFilePrefix(String sourceFile) {
        String archivePrefix = sourceFile + BronzeRepository.ARCHIVE_SEPARATOR;
        Long value = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM silver_records
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

    private boolean exists(String naturalKey) {
        Long value = jdbc.queryForObject(
            "SELECT COUNT(*) FROM silver_records WHERE natural_key = :naturalKey",
            new MapSqlParameterSource().addValue("naturalKey", naturalKey),
            Long.class
        );
        return value != null && value > 0;
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp value) {
        return value == null ? null : value.toInstant();
    }
}
