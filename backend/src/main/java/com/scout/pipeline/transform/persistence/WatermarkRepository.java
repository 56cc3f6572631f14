package com.scout.pipeline.transform.persistence;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class WatermarkRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public WatermarkRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void markSuccess(String objectId, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("objectId", objectId)
            .addValue("now", Timestamp.from(now));
        String update = """
            UPDATE etl_watermarks
            SET ok = TRUE,
                processed_at = :now,
                message = NULL
            WHERE object_id = :objectId
            """;
        if (jdbc.update(update, params) > 0) {
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO etl_watermarks (object_id, processed_at, ok, message)
                    VALUES (:objectId, :now, TRUE, NULL)
                    """,
                params
            );
        } catch (DataIntegrityViolationException e) {
            jdbc.update(update, params);
        }
    }

    /**
     * Records a failed promotion. A watermark that is already successful is left as it is, and
     * false is returned.
     */
    public boolean markFailure(String objectId, String message, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("objectId", objectId)
            .addValue("message", message)
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE etl_watermarks
                SET processed_at = :now,
                    message = :message
                WHERE object_id = :objectId
                  AND ok = FALSE
                """,
            params
        );
        if (updated > 0) {
            return true;
        }
        if (isPresent(objectId)) {
            return false;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO etl_watermarks (object_id, processed_at, ok, message)
                    VALUES (:objectId, :now, FALSE, :message)
                    """,
                params
            );
            return true;
        } catch (DataIntegrityViolationException e) {
            return false;
        }
    }

    public Optional<Boolean> findOk(String objectId) {
        List<Boolean> rows = jdbc.queryForList(
            "SELECT ok FROM etl_watermarks WHERE object_id = :objectId",
            new MapSqlParameterSource().addValue("objectId", objectId),
            Boolean.class
        );
        return rows.stream().findFirst();
    }

    public long countByOk(boolean ok) {
        Long value = jdbc.queryForObject(
            "SELECT COUNT(*) FROM etl_watermarks WHERE ok = :ok",
            new MapSqlParameterSource().addValue("ok", ok),
            Long.class
        );
        return value == null ? 0L : value;
    }

    public Instant latestProcessedAt() {
        Timestamp value = jdbc.queryForObject(
            "SELECT MAX(processed_at) FROM etl_watermarks",
            new MapSqlParameterSource(),
            Timestamp.class
        );
        return value == null ? null : value.toInstant();
    }

    private boolean isPresent(String objectId) {
        return findOk(objectId).isPresent();
    }
}
