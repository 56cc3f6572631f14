package com.scout.pipeline.crawl.persistence;

import com.scout.pipeline.crawl.model.DomainState;
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
public class DomainStateRepository {
    private static final RowMapper<DomainState> ROW_MAPPER = (rs, rowNum) -> new DomainState(
        rs.getString("domain"),
        rs.getInt("in_flight"),
        toInstant(rs.getTimestamp("last_fetch_at")),
        rs.getLong("min_spacing_ms"),
        toInstant(rs.getTimestamp("updated_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public DomainStateRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<DomainState> find(String domain) {
        List<DomainState> rows = jdbc.query(
            """
                SELECT domain, in_flight, last_fetch_at, min_spacing_ms, updated_at
                FROM domain_state
                WHERE domain = :domain
                """,
            new MapSqlParameterSource().addValue("domain", domain),
            ROW_MAPPER
        );
        return rows.stream().findFirst();
    }

    public List<DomainState> findAll() {
        return jdbc.query(
            """
                SELECT domain, in_flight, last_fetch_at, min_spacing_ms, updated_at
                FROM domain_state
                ORDER BY domain
                """,
            new MapSqlParameterSource(),
            ROW_MAPPER
        );
    }

    /**
     * Creates the row with the given spacing when missing. Returns true when a row was created.
     */
    public boolean insertIfAbsent(String domain, long minSpacingMs, Instant now) {
        if (find(domain).isPresent()) {
            return false;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO domain_state (domain, in_flight, last_fetch_at, min_spacing_ms, updated_at)
                    VALUES (:domain, 0, NULL, :minSpacingMs, :now)
                    """,
                new MapSqlParameterSource()
                    .addValue("domain", domain)
                    .addValue("minSpacingMs", Math.max(0, minSpacingMs))
                    .addValue("now", toTimestamp(now))
            );
            return true;
        } catch (DataIntegrityViolationException ignored) {
            return false;
        }
    }

    public void recordClaim(String domain, long defaultSpacingMs, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("domain", domain)
            .addValue("minSpacingMs", Math.max(0, defaultSpacingMs))
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE domain_state
                SET in_flight = in_flight + 1,
                    last_fetch_at = :now,
                    updated_at = :now
                WHERE domain = :domain
                """,
            params
        );
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO domain_state (domain, in_flight, last_fetch_at, min_spacing_ms, updated_at)
                        VALUES (:domain, 1, :now, :minSpacingMs, :now)
                        """,
                    params
                );
            } catch (DataIntegrityViolationException ignored) {
                jdbc.update(
                    """
                        UPDATE domain_state
                        SET in_flight = in_flight + 1,
                            last_fetch_at = :now,
                            updated_at = :now
                        WHERE domain = :domain
                        """,
                    params
                );
            }
        }
    }

    public void recordRelease(String domain, Instant now) {
        jdbc.update(
            """
                UPDATE domain_state
                SET in_flight = CASE WHEN in_flight > 0 THEN in_flight - 1 ELSE 0 END,
                    last_fetch_at = :now,
                    updated_at = :now
                WHERE domain = :domain
                """,
            new MapSqlParameterSource()
                .addValue("domain", domain)
                .addValue("now", toTimestamp(now))
        );
    }

    public void upsertSpacing(String domain, long minSpacingMs, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("domain", domain)
            .addValue("minSpacingMs", Math.max(0, minSpacingMs))
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE domain_state
                SET min_spacing_ms = :minSpacingMs,
                    updated_at = :now
                WHERE domain = :domain
                """,
            params
        );
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO domain_state (domain, in_flight, last_fetch_at, min_spacing_ms, updated_at)
                        VALUES (:domain, 0, NULL, :minSpacingMs, :now)
                        """,
                    params
                );
            } catch (DataIntegrityViolationException ignored) {
                jdbc.update(
                    """
                        UPDATE domain_state
                        SET min_spacing_ms = :minSpacingMs,
                            updated_at = :now
                        WHERE domain = :domain
                        """,
                    params
                );
            }
        }
    }

    /**
     * Raises every domain's spacing to at least the given value and clears in-flight counters.
     */
    public int raiseAllSpacing(long minSpacingMs, Instant now) {
        return jdbc.update(
            """
                UPDATE domain_state
                SET min_spacing_ms = CASE WHEN min_spacing_ms < :minSpacingMs THEN :minSpacingMs ELSE min_spacing_ms END,
                    in_flight = 0,
                    last_fetch_at = :now,
                    updated_at = :now
                """,
            new MapSqlParameterSource()
                .addValue("minSpacingMs", Math.max(0, minSpacingMs))
                .addValue("now", toTimestamp(now))
        );
    }
}
