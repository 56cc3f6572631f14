package com.scout.pipeline.crawl.persistence;

import com.scout.pipeline.crawl.model.CrawlJob;
import com.scout.pipeline.crawl.model.DomainPressure;
import com.scout.pipeline.crawl.model.JobStatus;
import com.scout.pipeline.crawl.model.RetryDecision;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable crawl job queue. Every state transition is a conditional update so that two workers
 * racing on the same row never both win.
 */
@Repository
public class CrawlJobRepository {
    private static final String JOB_COLUMNS = """
        job_id, source_key, domain, resource, depth, priority, status, attempts,
        next_eligible_at, lease_owner, lease_at, parent_resource, note, last_error,
        created_at, updated_at, finished_at
        """;

    private static final String QUARANTINED_SOURCE = """
        EXISTS (
            SELECT 1 FROM crawl_sources s
            WHERE s.source_key = crawl_jobs.source_key
              AND s.quarantined = TRUE
        )
        """;

    private static final RowMapper<CrawlJob> JOB_ROW_MAPPER = (rs, rowNum) -> new CrawlJob(
        rs.getLong("job_id"),
        rs.getString("source_key"),
        rs.getString("domain"),
        rs.getString("resource"),
        rs.getInt("depth"),
        rs.getInt("priority"),
        JobStatus.fromDb(rs.getString("status")),
        rs.getInt("attempts"),
        toInstant(rs.getTimestamp("next_eligible_at")),
        rs.getString("lease_owner"),
        toInstant(rs.getTimestamp("lease_at")),
        rs.getString("parent_resource"),
        rs.getString("note"),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")),
        toInstant(rs.getTimestamp("finished_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public CrawlJobRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Inserts a job row. Returns null when a row for (source, resource) already exists.
     */
    public Long insert(
        String sourceKey,
        String domain,
        String resource,
        int depth,
        int priority,
        JobStatus status,
        String parentResource,
        String note,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceKey", sourceKey)
            .addValue("domain", domain)
            .addValue("resource", resource)
            .addValue("depth", Math.max(0, depth))
            .addValue("priority", priority)
            .addValue("status", status.name())
            .addValue("parentResource", parentResource)
            .addValue("note", note)
            .addValue("now", toTimestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbc.update(
                """
                    INSERT INTO crawl_jobs (
                        source_key, domain, resource, depth, priority, status, attempts,
                        next_eligible_at, parent_resource, note, created_at, updated_at
                    )
                    VALUES (
                        :sourceKey, :domain, :resource, :depth, :priority, :status, 0,
                        :now, :parentResource, :note, :now, :now
                    )
                    """,
                params,
                keyHolder,
                new String[] {"job_id"}
            );
        } catch (DataIntegrityViolationException duplicate) {
            return null;
        }
        Number key = keyHolder.getKey();
        return key == null ? null : key.longValue();
    }

    public Optional<CrawlJob> findById(long jobId) {
        List<CrawlJob> rows = jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM crawl_jobs WHERE job_id = :jobId",
            new MapSqlParameterSource().addValue("jobId", jobId),
            JOB_ROW_MAPPER
        );
        return rows.stream().findFirst();
    }

    public Optional<CrawlJob> findByKey(String sourceKey, String resource) {
        List<CrawlJob> rows = jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM crawl_jobs WHERE source_key = :sourceKey AND resource = :resource",
            new MapSqlParameterSource()
                .addValue("sourceKey", sourceKey)
                .addValue("resource", resource),
            JOB_ROW_MAPPER
        );
        return rows.stream().findFirst();
    }

    public List<CrawlJob> findClaimCandidates(Instant now, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM crawl_jobs
                WHERE status = 'QUEUED'
                  AND next_eligible_at <= :now
                """ + "  AND NOT " + QUARANTINED_SOURCE + """
                ORDER BY priority ASC, created_at ASC, job_id ASC
                LIMIT :limit
                """,
            params,
            JOB_ROW_MAPPER
        );
    }

    /**
     * Compare-and-swap claim. Returns false when another worker took the row first.
     */
    public boolean tryClaim(long jobId, String leaseOwner, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("leaseOwner", leaseOwner)
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = 'RUNNING',
                    lease_owner = :leaseOwner,
                    lease_at = :now,
                    updated_at = :now
                WHERE job_id = :jobId
                  AND status = 'QUEUED'
                  AND next_eligible_at <= :now
                """ + "  AND NOT " + QUARANTINED_SOURCE,
            params
        );
        return updated == 1;
    }

    public boolean markDone(long jobId, String leaseOwner, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("leaseOwner", leaseOwner)
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = 'DONE',
                    attempts = 0,
                    lease_owner = NULL,
                    lease_at = NULL,
                    last_error = NULL,
                    finished_at = :now,
                    updated_at = :now
                WHERE job_id = :jobId
                  AND status = 'RUNNING'
                  AND lease_owner = :leaseOwner
                """,
            params
        );
        return updated == 1;
    }

    public boolean applyFailure(long jobId, String leaseOwner, RetryDecision decision, String error, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("leaseOwner", leaseOwner)
            .addValue("status", decision.status().name())
            .addValue("attempts", decision.attempts())
            .addValue("nextEligibleAt", toTimestamp(decision.nextEligibleAt()))
            .addValue("lastError", error)
            .addValue("finishedAt", decision.status().isTerminal() ? toTimestamp(now) : null)
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = :status,
                    attempts = :attempts,
                    next_eligible_at = :nextEligibleAt,
                    lease_owner = NULL,
                    lease_at = NULL,
                    last_error = :lastError,
                    finished_at = :finishedAt,
                    updated_at = :now
                WHERE job_id = :jobId
                  AND status = 'RUNNING'
                  AND lease_owner = :leaseOwner
                """,
            params
        );
        return updated == 1;
    }

    /**
     * Moves a finished row back to the queue for a recrawl.
     */
    public boolean requeueFinished(String sourceKey, String resource, int priority, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceKey", sourceKey)
            .addValue("resource", resource)
            .addValue("priority", priority)
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = 'QUEUED',
                    attempts = 0,
                    priority = :priority,
                    next_eligible_at = :now,
                    finished_at = NULL,
                    note = 'recrawl',
                    updated_at = :now
                WHERE source_key = :sourceKey
                  AND resource = :resource
                  AND status IN ('DONE', 'FAILED')
                """,
            params
        );
        return updated == 1;
    }

    public boolean pullEligibilityEarlier(String sourceKey, String resource, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceKey", sourceKey)
            .addValue("resource", resource)
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET next_eligible_at = :now,
                    updated_at = :now
                WHERE source_key = :sourceKey
                  AND resource = :resource
                  AND status = 'QUEUED'
                  AND next_eligible_at > :now
                """,
            params
        );
        return updated == 1;
    }

    public List<CrawlJob> findStaleRunning(Instant leaseCutoff) {
        return jdbc.query(
            "SELECT " + JOB_COLUMNS + """
                FROM crawl_jobs
                WHERE status = 'RUNNING'
                  AND (lease_at IS NULL OR lease_at < :cutoff)
                ORDER BY lease_at ASC
                """,
            new MapSqlParameterSource().addValue("cutoff", toTimestamp(leaseCutoff)),
            JOB_ROW_MAPPER
        );
    }

    /**
     * Requeues a stale lease only if nobody renewed or re-claimed it since it was read.
     */
    public boolean requeueStale(CrawlJob stale, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", stale.jobId())
            .addValue("leaseOwner", stale.leaseOwner())
            .addValue("leaseAt", toTimestamp(stale.leaseAt()))
            .addValue("now", toTimestamp(now));
        String ownerPredicate = stale.leaseOwner() == null ? "lease_owner IS NULL" : "lease_owner = :leaseOwner";
        String leasePredicate = stale.leaseAt() == null ? "lease_at IS NULL" : "lease_at = :leaseAt";
        int updated = jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = 'QUEUED',
                    lease_owner = NULL,
                    lease_at = NULL,
                    next_eligible_at = :now,
                    note = 'stale_lease_requeued',
                    updated_at = :now
                WHERE job_id = :jobId
                  AND status = 'RUNNING'
                """ + "  AND " + ownerPredicate + " AND " + leasePredicate,
            params
        );
        return updated == 1;
    }

    public int requeueAllRunning(Instant now) {
        return jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = 'QUEUED',
                    lease_owner = NULL,
                    lease_at = NULL,
                    next_eligible_at = :now,
                    note = 'emergency_stop',
                    updated_at = :now
                WHERE status = 'RUNNING'
                """,
            new MapSqlParameterSource().addValue("now", toTimestamp(now))
        );
    }

    public int blockQueuedForSource(String sourceKey, String reason, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceKey", sourceKey)
            .addValue("reason", reason)
            .addValue("now", toTimestamp(now));
        return jdbc.update(
            """
                UPDATE crawl_jobs
                SET status = 'BLOCKED',
                    last_error = :reason,
                    finished_at = :now,
                    updated_at = :now
                WHERE source_key = :sourceKey
                  AND status = 'QUEUED'
                """,
            params
        );
    }

    public int releaseJob(long jobId, Instant now) {
        return jdbc.update(
            releaseSql("job_id = :jobId"),
            new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("now", toTimestamp(now))
        );
    }

    public int releaseSource(String sourceKey, Instant now) {
        return jdbc.update(
            releaseSql("source_key = :sourceKey"),
            new MapSqlParameterSource()
                .addValue("sourceKey", sourceKey)
                .addValue("now", toTimestamp(now))
        );
    }

    public int releaseDomain(String domain, Instant now) {
        return jdbc.update(
            releaseSql("domain = :domain"),
            new MapSqlParameterSource()
                .addValue("domain", domain)
                .addValue("now", toTimestamp(now))
        );
    }

    /**
     * Resets failed rows. Rows of a quarantined source go to BLOCKED so that releasing the source
     * brings them back.
     */
    public int retryFailed(String resource, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("resource", resource)
            .addValue("now", toTimestamp(now));
        String quarantinedCase = "CASE WHEN " + QUARANTINED_SOURCE;
        String sql = """
            UPDATE crawl_jobs
            SET status = %s THEN 'BLOCKED' ELSE 'QUEUED' END,
                last_error = %s THEN 'quarantined: source is quarantined' ELSE last_error END,
                attempts = 0,
                next_eligible_at = :now,
                finished_at = NULL,
                note = 'retry_failed',
                updated_at = :now
            WHERE status = 'FAILED'
            """.formatted(quarantinedCase, quarantinedCase);
        if (resource != null && !resource.isBlank()) {
            sql = sql + "  AND resource = :resource";
        }
        return jdbc.update(sql, params);
    }

    public int purgeFinished(Instant cutoff) {
        return jdbc.update(
            """
                DELETE FROM crawl_jobs
                WHERE status IN ('DONE', 'FAILED')
                  AND finished_at IS NOT NULL
                  AND finished_at < :cutoff
                """,
            new MapSqlParameterSource().addValue("cutoff", toTimestamp(cutoff))
        );
    }

    public long countByStatus(JobStatus status) {
        Long value = jdbc.queryForObject(
            "SELECT COUNT(*) FROM crawl_jobs WHERE status = :status",
            new MapSqlParameterSource().addValue("status", status.name()),
            Long.class
        );
        return value == null ? 0L : value;
    }

    public long countFinishedSince(JobStatus status, Instant since) {
        Long value = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM crawl_jobs
                WHERE status = :status
                  AND updated_at >= :since
                """,
            new MapSqlParameterSource()
                .addValue("status", status.name())
                .addValue("since", toTimestamp(since)),
            Long.class
        );
        return value == null ? 0L : value;
    }

    public long countRunningForResource(String sourceKey, String resource) {
        Long value = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM crawl_jobs
                WHERE source_key = :sourceKey
                  AND resource = :resource
                  AND status = 'RUNNING'
                """,
            new MapSqlParameterSource()
                .addValue("sourceKey", sourceKey)
                .addValue("resource", resource),
            Long.class
        );
        return value == null ? 0L : value;
    }

    public long countChildren(String sourceKey, String parentResource) {
        Long value = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM crawl_jobs
                WHERE source_key = :sourceKey
                  AND parent_resource = :parentResource
                """,
            new MapSqlParameterSource()
                .addValue("sourceKey", sourceKey)
                .addValue("parentResource", parentResource),
            Long.class
        );
        return value == null ? 0L : value;
    }

    public List<DomainPressure> fetchDomainPressure() {
        return jdbc.query(
            """
                SELECT j.domain,
                       SUM(CASE WHEN j.status = 'QUEUED' THEN 1 ELSE 0 END) AS queued,
                       SUM(CASE WHEN j.status = 'RUNNING' THEN 1 ELSE 0 END) AS running,
                       SUM(CASE WHEN j.status = 'FAILED' THEN 1 ELSE 0 END) AS failed,
                       SUM(CASE WHEN j.status = 'BLOCKED' THEN 1 ELSE 0 END) AS blocked,
                       MIN(CASE WHEN j.status = 'QUEUED' THEN j.next_eligible_at END) AS next_due_at,
                       MAX(d.in_flight) AS in_flight,
                       MAX(d.min_spacing_ms) AS min_spacing_ms
                FROM crawl_jobs j
                LEFT JOIN domain_state d ON d.domain = j.domain
                GROUP BY j.domain
                ORDER BY queued DESC, j.domain ASC
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new DomainPressure(
                rs.getString("domain"),
                rs.getLong("queued"),
                rs.getLong("running"),
                rs.getLong("failed"),
                rs.getLong("blocked"),
                toInstant(rs.getTimestamp("next_due_at")),
                rs.getInt("in_flight"),
                rs.getLong("min_spacing_ms")
            )
        );
    }

    private static String releaseSql(String predicate) {
        return """
            UPDATE crawl_jobs
            SET status = 'QUEUED',
                attempts = 0,
                next_eligible_at = :now,
                finished_at = NULL,
                note = 'released',
                updated_at = :now
            WHERE status = 'BLOCKED'
            """ + "  AND " + predicate;
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
