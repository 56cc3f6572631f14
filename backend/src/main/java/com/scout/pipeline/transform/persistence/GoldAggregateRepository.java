package com.scout.pipeline.transform.persistence;

import com.scout.pipeline.transform.model.AggregateRefresh;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Gold aggregates are rebuilt wholesale from the silver layer. Callers run each rebuild in its own
 * transaction under the refresh lock.
 */
@Repository
public class GoldAggregateRepository {
    public static final String DAILY_METRICS = "gold_daily_metrics";
    public static final String SOURCE_FILE_METRICS = "gold_source_file_metrics";

    private static final RowMapper<AggregateRefresh> REFRESH_ROW_MAPPER = (rs, rowNum) -> new AggregateRefresh(
        rs.getString("aggregate_name"),
        rs.getLong("rows_written"),
        rs.getLong("duration_ms"),
        rs.getString("lock_owner"),
        rs.getTimestamp("refreshed_at").toInstant()
    );

    private final NamedParameterJdbcTemplate jdbc;

    public GoldAggregateRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public int rebuildDailyMetrics(Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", Timestamp.from(now));
        jdbc.update("DELETE FROM gold_daily_metrics", params);
        return jdbc.update(
            """
                INSERT INTO gold_daily_metrics (metric_date, store_key, txn_count, total_amount, refreshed_at)
                SELECT CAST(event_time AS DATE), store_key, COUNT(*), COALESCE(SUM(amount), 0), :now
                FROM silver_records
                GROUP BY CAST(event_time AS DATE), store_key
                """,
            params
        );
    }

    public int rebuildSourceFileMetrics(Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", Timestamp.from(now));
        jdbc.update("DELETE FROM gold_source_file_metrics", params);
        return jdbc.update(
            """
                INSERT INTO gold_source_file_metrics (
                    source_file, record_count, total_amount, first_event_at, last_event_at, refreshed_at
                )
                SELECT source_file, COUNT(*), COALESCE(SUM(amount), 0), MIN(event_time), MAX(event_time), :now
                FROM silver_records
                GROUP BY source_file
                """,
            params
        );
    }

    public void logRefresh(AggregateRefresh refresh) {
        jdbc.update(
            """
                INSERT INTO aggregate_refresh_log (aggregate_name, rows_written, duration_ms, lock_owner, refreshed_at)
                VALUES (:name, :rowsWritten, :durationMs, :lockOwner, :refreshedAt)
                """,
            new MapSqlParameterSource()
                .addValue("name", refresh.aggregateName())
                .addValue("rowsWritten", refresh.rowsWritten())
                .addValue("durationMs", refresh.durationMs())
                .addValue("lockOwner", refresh.lockOwner())
                .addValue("refreshedAt", Timestamp.from(refresh.refreshedAt()))
        );
    }

    public List<AggregateRefresh> listRefreshLog(int limit) {
        return jdbc.query(
            """
                SELECT aggregate_name, rows_written, duration_ms, lock_owner, refreshed_at
                FROM aggregate_refresh_log
                ORDER BY refreshed_at DESC, refresh_id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit)),
            REFRESH_ROW_MAPPER
        );
    }

    public long countDailyMetrics() {
        return count("SELECT COUNT(*) FROM gold_daily_metrics");
    }

    public long countSourceFileMetrics() {
        return count("SELECT COUNT(*) FROM gold_source_file_metrics");
    }

    public Instant latestRefreshAt() {
        Timestamp value = jdbc.queryForObject(
            "SELECT MAX(refreshed_at) FROM aggregate_refresh_log",
            new MapSqlParameterSource(),
            Timestamp.class
        );
        return value == null ? null : value.toInstant();
    }

    private long count(String sql) {
        Long value = jdbc.queryForObject(sql, new MapSqlParameterSource(), Long.class);
        return value == null ? 0L : value;
    }
}
