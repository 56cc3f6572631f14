package com.scout.pipeline.crawl.persistence;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static com.scout.pipeline.crawl.persistence.CrawlJobRepository.toTimestamp;

@Repository
public class CrawlSourceRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public CrawlSourceRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Registers the source when missing. Returns true when this call created the row.
     */
    public boolean ensureSource(String sourceKey, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceKey", sourceKey)
            .addValue("now", toTimestamp(now));
        Integer existing = jdbc.queryForObject(
            "SELECT COUNT(*) FROM crawl_sources WHERE source_key = :sourceKey",
            params,
            Integer.class
        );
        if (existing != null && existing > 0) {
            return false;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO crawl_sources (source_key, quarantined, created_at, updated_at)
                    VALUES (:sourceKey, FALSE, :now, :now)
                    """,
                params
            );
            return true;
        } catch (DataIntegrityViolationException ignored) {
            return false;
        }
    }

    public boolean exists(String sourceKey) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM crawl_sources WHERE source_key = :sourceKey",
            new MapSqlParameterSource().addValue("sourceKey", sourceKey),
            Integer.class
        );
        return count != null && count > 0;
    }

    public boolean isQuarantined(String sourceKey) {
        List<Boolean> rows = jdbc.query(
            "SELECT quarantined FROM crawl_sources WHERE source_key = :sourceKey",
            new MapSqlParameterSource().addValue("sourceKey", sourceKey),
            (rs, rowNum) -> rs.getBoolean("quarantined")
        );
        return !rows.isEmpty() && Boolean.TRUE.equals(rows.get(0));
    }

    public int setQuarantined(String sourceKey, boolean quarantined, String reason, Instant now) {
        return jdbc.update(
            """
                UPDATE crawl_sources
                SET quarantined = :quarantined,
                    quarantine_reason = :reason,
                    quarantined_at = :quarantinedAt,
                    updated_at = :now
                WHERE source_key = :sourceKey
                """,
            new MapSqlParameterSource()
                .addValue("sourceKey", sourceKey)
                .addValue("quarantined", quarantined)
                .addValue("reason", quarantined ? reason : null)
                .addValue("quarantinedAt", quarantined ? toTimestamp(now) : null)
                .addValue("now", toTimestamp(now))
        );
    }

    public long countQuarantined() {
        Long value = jdbc.queryForObject(
            "SELECT COUNT(*) FROM crawl_sources WHERE quarantined = TRUE",
            new MapSqlParameterSource(),
            Long.class
        );
        return value == null ? 0L : value;
    }
}
