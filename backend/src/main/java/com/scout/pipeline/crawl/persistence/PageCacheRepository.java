package com.scout.pipeline.crawl.persistence;

import com.scout.pipeline.crawl.model.PageCacheEntry;
import com.scout.pipeline.crawl.model.ParseStatus;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.scout.pipeline.crawl.persistence.CrawlJobRepository.toInstant;
import static com.scout.pipeline.crawl.persistence.CrawlJobRepository.toTimestamp;

@Repository
public class PageCacheRepository {
    private static final RowMapper<PageCacheEntry> ROW_MAPPER = (rs, rowNum) -> new PageCacheEntry(
        rs.getString("source_key"),
        rs.getString("resource"),
        rs.getObject("http_status", Integer.class),
        rs.getString("etag"),
        rs.getString("last_modified"),
        rs.getString("content_sha256"),
        toInstant(rs.getTimestamp("fetched_at")),
        ParseStatus.fromDb(rs.getString("parse_status")),
        rs.getString("parse_note")
    );

    private final NamedParameterJdbcTemplate jdbc;

    public PageCacheRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<PageCacheEntry> find(String sourceKey, String resource) {
        List<PageCacheEntry> rows = jdbc.query(
            """
                SELECT source_key, resource, http_status, etag, last_modified, content_sha256,
                       fetched_at, parse_status, parse_note
                FROM page_cache
                WHERE source_key = :sourceKey
                  AND resource = :resource
                """,
            new MapSqlParameterSource()
                .addValue("sourceKey", sourceKey)
                .addValue("resource", resource),
            ROW_MAPPER
        );
        return rows.stream().findFirst();
    }

    /**
     * Upserts the cache row. Conditional-fetch metadata and the fingerprint keep their previous
     * values when the new outcome does not carry them (a 304 has no body to hash).
     */
    public void upsert(PageCacheEntry entry) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceKey", entry.sourceKey())
            .addValue("resource", entry.resource())
            .addValue("httpStatus", entry.httpStatus())
            .addValue("etag", entry.etag())
            .addValue("lastModified", entry.lastModified())
            .addValue("contentSha256", entry.contentSha256())
            .addValue("fetchedAt", toTimestamp(entry.fetchedAt()))
            .addValue("parseStatus", entry.parseStatus() == null ? null : entry.parseStatus().name())
            .addValue("parseNote", entry.parseNote());
        String updateSql = """
            UPDATE page_cache
            SET http_status = :httpStatus,
                etag = COALESCE(:etag, etag),
                last_modified = COALESCE(:lastModified, last_modified),
                content_sha256 = COALESCE(:contentSha256, content_sha256),
                fetched_at = :fetchedAt,
                parse_status = :parseStatus,
                parse_note = :parseNote
            WHERE source_key = :sourceKey
              AND resource = :resource
            """;
        int updated = jdbc.update(updateSql, params);
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO page_cache (
                            source_key, resource, http_status, etag, last_modified, content_sha256,
                            fetched_at, parse_status, parse_note
                        )
                        VALUES (
                            :sourceKey, :resource, :httpStatus, :etag, :lastModified, :contentSha256,
                            :fetchedAt, :parseStatus, :parseNote
                        )
                        """,
                    params
                );
            } catch (DataIntegrityViolationException ignored) {
                jdbc.update(updateSql, params);
            }
        }
    }

    /**
     * Cache rows whose age exceeds the TTL for their last parse outcome, oldest first.
     */
    public List<PageCacheEntry> findDueForRecrawl(Instant successCutoff, Instant failureCutoff, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("successCutoff", toTimestamp(successCutoff))
            .addValue("failureCutoff", toTimestamp(failureCutoff))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT source_key, resource, http_status, etag, last_modified, content_sha256,
                       fetched_at, parse_status, parse_note
                FROM page_cache
                WHERE (parse_status IN ('OK', 'NOT_MODIFIED') AND fetched_at < :successCutoff)
                   OR ((parse_status IS NULL OR parse_status NOT IN ('OK', 'NOT_MODIFIED'))
                       AND (fetched_at IS NULL OR fetched_at < :failureCutoff))
                ORDER BY fetched_at ASC
                LIMIT :limit
                """,
            params,
            ROW_MAPPER
        );
    }
}
