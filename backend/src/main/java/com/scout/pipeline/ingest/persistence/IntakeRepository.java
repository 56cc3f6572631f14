package com.scout.pipeline.ingest.persistence;

import com.scout.pipeline.crawl.model.FailureKind;
import com.scout.pipeline.crawl.model.JobStatus;
import com.scout.pipeline.crawl.model.RetryDecision;
import com.scout.pipeline.ingest.model.FileType;
import com.scout.pipeline.ingest.model.IngestionHistoryEntry;
import com.scout.pipeline.ingest.model.IngestionPerformance;
import com.scout.pipeline.ingest.model.IntakeFailure;
import com.scout.pipeline.ingest.model.IntakeQueueStatus;
import com.scout.pipeline.ingest.model.IntakeRecord;
import com.scout.pipeline.ingest.model.SourceKind;
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

@Repository
public class IntakeRepository {
    private static final String INTAKE_COLUMNS = """
        intake_id, file_name, file_type, size_bytes, checksum, source_kind, bucket, object_path,
        content_ref, mime_type, priority, status, attempts, next_eligible_at, lease_owner, lease_at,
        error_message, records_processed, created_at, updated_at, finished_at
        """;

    private static final RowMapper<IntakeRecord> INTAKE_ROW_MAPPER = (rs, rowNum) -> new IntakeRecord(
        rs.getLong("intake_id"),
        rs.getString("file_name"),
        FileType.fromDb(rs.getString("file_type")),
        rs.getLong("size_bytes"),
        rs.getString("checksum"),
        SourceKind.valueOf(rs.getString("source_kind")),
        rs.getString("bucket"),
        rs.getString("object_path"),
        rs.getString("content_ref"),
        rs.getString("mime_type"),
        rs.getInt("priority"),
        JobStatus.fromDb(rs.getString("status")),
        rs.getInt("attempts"),
        toInstant(rs.getTimestamp("next_eligible_at")),
        rs.getString("lease_owner"),
        toInstant(rs.getTimestamp("lease_at")),
        rs.getString("error_message"),
        rs.getInt("records_processed"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")),
        toInstant(rs.getTimestamp("finished_at"))
    );

    private static final RowMapper<IngestionHistoryEntry> HISTORY_ROW_MAPPER = (rs, rowNum) -> new IngestionHistoryEntry(
        rs.getLong("history_id"),
        rs.getObject("intake_id", Long.class),
        rs.getString("file_name"),
        FileType.fromDb(rs.getString("file_type")),
        SourceKind.valueOf(rs.getString("source_kind")),
        JobStatus.fromDb(rs.getString("status")),
        rs.getInt("attempts"),
        rs.getInt("records_processed"),
        rs.getInt("records_failed"),
        rs.getLong("elapsed_ms"),
        rs.getString("error_detail"),
        toInstant(rs.getTimestamp("processed_at"))
    );

    private static final RowMapper<IntakeFailure> FAILURE_ROW_MAPPER = (rs, rowNum) -> new IntakeFailure(
        rs.getLong("failure_id"),
        rs.getString("file_name"),
        rs.getString("bucket"),
        rs.getString("object_path"),
        rs.getObject("size_bytes", Long.class),
        FailureKind.valueOf(rs.getString("error_kind")),
        rs.getString("error_message"),
        rs.getInt("attempts"),
        toInstant(rs.getTimestamp("failed_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public IntakeRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Inserts a queued intake record. Returns null when the checksum is already present.
     */
    public Long insert(
        String fileName,
        FileType fileType,
        long sizeBytes,
        String checksum,
        SourceKind sourceKind,
        String bucket,
        String objectPath,
        String contentRef,
        String mimeType,
        int priority,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("fileName", fileName)
            .addValue("fileType", fileType.name())
            .addValue("sizeBytes", sizeBytes)
            .addValue("checksum", checksum)
            .addValue("sourceKind", sourceKind.name())
            .addValue("bucket", bucket)
            .addValue("objectPath", objectPath)
            .addValue("contentRef", contentRef)
            .addValue("mimeType", mimeType)
            .addValue("priority", priority)
            .addValue("now", toTimestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbc.update(
                """
                    INSERT INTO file_intake (
                        file_name, file_type, size_bytes, checksum, source_kind, bucket, object_path,
                        content_ref, mime_type, priority, status, attempts, next_eligible_at,
                        records_processed, created_at, updated_at
                    )
                    VALUES (
                        :fileName, :fileType, :sizeBytes, :checksum, :sourceKind, :bucket, :objectPath,
                        :contentRef, :mimeType, :priority, 'QUEUED', 0, :now,
                        0, :now, :now
                    )
                    """,
                params,
                keyHolder,
                new String[] {"intake_id"}
            );
        } catch (DataIntegrityViolationException duplicate) {
            return null;
        }
        Number key = keyHolder.getKey();
        return key == null ? null : key.longValue();
    }

    public Optional<IntakeRecord> findById(long intakeId) {
        List<IntakeRecord> rows = jdbc.query(
            "SELECT " + INTAKE_COLUMNS + " FROM file_intake WHERE intake_id = :intakeId",
            new MapSqlParameterSource().addValue("intakeId", intakeId),
            INTAKE_ROW_MAPPER
        );
        return rows.stream().findFirst();
    }

    public Optional<IntakeRecord> findByChecksum(String checksum) {
        List<IntakeRecord> rows = jdbc.query(
            "SELECT " + INTAKE_COLUMNS + " FROM file_intake WHERE checksum = :checksum",
            new MapSqlParameterSource().addValue("checksum", checksum),
            INTAKE_ROW_MAPPER
        );
        return rows.stream().findFirst();
    }

    /**
     * Puts a failed or quarantined record back in the queue, e.g. after a resubmission of the same bytes.
     */
    public boolean requeue(long intakeId, int priority, Instant now) {
        int updated = jdbc.update(
            """
                UPDATE file_intake
                SET status = 'QUEUED',
                    attempts = 0,
                    priority = :priority,
                    next_eligible_at = :now,
                    error_message = NULL,
                    finished_at = NULL,
                    updated_at = :now
                WHERE intake_id = :intakeId
                  AND status IN ('FAILED', 'BLOCKED')
                """,
            new MapSqlParameterSource()
                .addValue("intakeId", intakeId)
                .addValue("priority", priority)
                .addValue("now", toTimestamp(now))
        );
        return updated == 1;
    }

    public List<IntakeRecord> findClaimCandidates(Instant now, int limit) {
        return jdbc.query(
            "SELECT " + INTAKE_COLUMNS + """
                FROM file_intake
                WHERE status = 'QUEUED'
                  AND next_eligible_at <= :now
                ORDER BY priority ASC, created_at ASC, intake_id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("now", toTimestamp(now))
                .addValue("limit", Math.max(1, limit)),
            INTAKE_ROW_MAPPER
        );
    }

    public boolean tryClaim(long intakeId, String leaseOwner, Instant now) {
        int updated = jdbc.update(
            """
                UPDATE file_intake
                SET status = 'RUNNING',
                    lease_owner = :leaseOwner,
                    lease_at = :now,
                    updated_at = :now
                WHERE intake_id = :intakeId
                  AND status = 'QUEUED'
                  AND next_eligible_at <= :now
                """,
            new MapSqlParameterSource()
                .addValue("intakeId", intakeId)
                .addValue("leaseOwner", leaseOwner)
                .addValue("now", toTimestamp(now))
        );
        return updated == 1;
    }

    public boolean markDone(long intakeId, String leaseOwner, int recordsProcessed, String note, Instant now) {
        int updated = jdbc.update(
            """
                UPDATE file_intake
                SET status = 'DONE',
                    lease_owner = NULL,
                    lease_at = NULL,
                    records_processed = :recordsProcessed,
                    error_message = :note,
                    finished_at = :now,
                    updated_at = :now
                WHERE intake_id = :intakeId
                  AND status = 'RUNNING'
                  AND lease_owner = :leaseOwner
                """,
            new MapSqlParameterSource()
                .addValue("intakeId", intakeId)
                .addValue("leaseOwner", leaseOwner)
                .addValue("recordsProcessed", recordsProcessed)
                .addValue("note", note)
                .addValue("now", toTimestamp(now))
        );
        return updated == 1;
    }

    public boolean applyFailure(long intakeId, String leaseOwner, RetryDecision decision, String error, Instant now) {
        int updated = jdbc.update(
            """
                UPDATE file_intake
                SET status = :status,
                    attempts = :attempts,
                    next_eligible_at = :nextEligibleAt,
                    lease_owner = NULL,
                    lease_at = NULL,
                    error_message = :error,
                    finished_at = :finishedAt,
                    updated_at = :now
                WHERE intake_id = :intakeId
                  AND status = 'RUNNING'
                  AND lease_owner = :leaseOwner
                """,
            new MapSqlParameterSource()
                .addValue("intakeId", intakeId)
                .addValue("leaseOwner", leaseOwner)
                .addValue("status", decision.status().name())
                .addValue("attempts", decision.attempts())
                .addValue("nextEligibleAt", toTimestamp(decision.nextEligibleAt()))
                .addValue("error", error)
                .addValue("finishedAt", decision.status().isTerminal() ? toTimestamp(now) : null)
                .addValue("now", toTimestamp(now))
        );
        return updated == 1;
    }

    public List<IntakeRecord> findStaleRunning(Instant leaseCutoff) {
        return jdbc.query(
            "SELECT " + INTAKE_COLUMNS + """
                FROM file_intake
                WHERE status = 'RUNNING'
                  AND (lease_at IS NULL OR lease_at < :cutoff)
                ORDER BY lease_at ASC
                """,
            new MapSqlParameterSource().addValue("cutoff", toTimestamp(leaseCutoff)),
            INTAKE_ROW_MAPPER
        );
    }

    public boolean requeueStale(IntakeRecord stale, Instant now) {
        String ownerPredicate = stale.leaseOwner() == null ? "lease_owner IS NULL" : "lease_owner = :leaseOwner";
        String leasePredicate = stale.leaseAt() == null ? "lease_at IS NULL" : "lease_at = :leaseAt";
        int updated = jdbc.update(
            """
                UPDATE file_intake
                SET status = 'QUEUED',
                    lease_owner = NULL,
                    lease_at = NULL,
                    next_eligible_at = :now,
                    updated_at = :now
                WHERE intake_id = :intakeId
                  AND status = 'RUNNING'
                """ + "  AND " + ownerPredicate + " AND " + leasePredicate,
            new MapSqlParameterSource()
                .addValue("intakeId", stale.intakeId())
                .addValue("leaseOwner", stale.leaseOwner())
                .addValue("leaseAt", toTimestamp(stale.leaseAt()))
                .addValue("now", toTimestamp(now))
        );
        return updated == 1;
    }

    public int requeueAllRunning(Instant now) {
        return jdbc.update(
            """
                UPDATE file_intake
                SET status = 'QUEUED',
                    lease_owner = NULL,
                    lease_at = NULL,
                    next_eligible_at = :now,
                    updated_at = :now
                WHERE status = 'RUNNING'
                """,
            new MapSqlParameterSource().addValue("now", toTimestamp(now))
        );
    }

    public int retryFailed(String fileName, Instant now) {
        String sql = """
            UPDATE file_intake
            SET status = 'QUEUED',
                attempts = 0,
                next_eligible_at = :now,
                finished_at = NULL,
                updated_at = :now
            WHERE status = 'FAILED'
            """;
        if (fileName != null && !fileName.isBlank()) {
            sql = sql + "  AND file_name = :fileName";
        }
        return jdbc.update(
            sql,
            new MapSqlParameterSource()
                .addValue("fileName", fileName == null ? null : fileName.trim())
                .addValue("now", toTimestamp(now))
        );
    }

    public int releaseBlocked(long intakeId, Instant now) {
        return jdbc.update(
            """
                UPDATE file_intake
                SET status = 'QUEUED',
                    attempts = 0,
                    next_eligible_at = :now,
                    finished_at = NULL,
                    updated_at = :now
                WHERE intake_id = :intakeId
                  AND status = 'BLOCKED'
                """,
            new MapSqlParameterSource()
                .addValue("intakeId", intakeId)
                .addValue("now", toTimestamp(now))
        );
    }

    public long countByStatus(JobStatus status) {
        Long value = jdbc.queryForObject(
            "SELECT COUNT(*) FROM file_intake WHERE status = :status",
            new MapSqlParameterSource().addValue("status", status.name()),
            Long.class
        );
        return value == null ? 0L : value;
    }

    public List<IntakeQueueStatus> queueStatus() {
        return jdbc.query(
            """
                SELECT status, COUNT(*) AS file_count, MIN(created_at) AS oldest_created_at,
                       MAX(created_at) AS newest_created_at, AVG(CAST(attempts AS DOUBLE PRECISION)) AS avg_attempts
                FROM file_intake
                GROUP BY status
                ORDER BY status
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new IntakeQueueStatus(
                JobStatus.fromDb(rs.getString("status")),
                rs.getLong("file_count"),
                toInstant(rs.getTimestamp("oldest_created_at")),
                toInstant(rs.getTimestamp("newest_created_at")),
                rs.getDouble("avg_attempts")
            )
        );
    }

    /**
     * Aggregates ingestion history since the cutoff by source kind. Every attempt is one row, so a
     * file retried three times counts three times.
     */
    public List<IngestionPerformance> performanceSince(Instant since) {
        return jdbc.query(
            """
                SELECT source_kind,
                       COUNT(*) AS files_processed,
                       SUM(CASE WHEN status = 'DONE' THEN 1 ELSE 0 END) AS successful,
                       SUM(CASE WHEN status IN ('FAILED', 'BLOCKED') THEN 1 ELSE 0 END) AS failed,
                       COALESCE(SUM(records_processed), 0) AS records_processed,
                       COALESCE(SUM(records_failed), 0) AS records_failed,
                       AVG(CAST(elapsed_ms AS DOUBLE PRECISION)) AS avg_elapsed_ms
                FROM ingestion_history
                WHERE processed_at >= :since
                GROUP BY source_kind
                ORDER BY source_kind
                """,
            new MapSqlParameterSource().addValue("since", toTimestamp(since)),
            (rs, rowNum) -> new IngestionPerformance(
                SourceKind.valueOf(rs.getString("source_kind")),
                rs.getLong("files_processed"),
                rs.getLong("successful"),
                rs.getLong("failed"),
                rs.getLong("records_processed"),
                rs.getLong("records_failed"),
                rs.getDouble("avg_elapsed_ms")
            )
        );
    }

    public void insertFailure(IntakeFailure failure) {
        jdbc.update(
            """
                INSERT INTO intake_failures (
                    file_name, bucket, object_path, size_bytes, error_kind, error_message, attempts, failed_at
                )
                VALUES (
                    :fileName, :bucket, :objectPath, :sizeBytes, :errorKind, :errorMessage, :attempts, :failedAt
                )
                """,
            new MapSqlParameterSource()
                .addValue("fileName", failure.fileName())
                .addValue("bucket", failure.bucket())
                .addValue("objectPath", failure.objectPath())
                .addValue("sizeBytes", failure.sizeBytes())
                .addValue("errorKind", failure.errorKind().name())
                .addValue("errorMessage", failure.errorMessage())
                .addValue("attempts", failure.attempts())
                .addValue("failedAt", toTimestamp(failure.failedAt()))
        );
    }

    public List<IntakeFailure> listFailures(int limit) {
        return jdbc.query(
            """
                SELECT failure_id, file_name, bucket, object_path, size_bytes, error_kind, error_message,
                       attempts, failed_at
                FROM intake_failures
                ORDER BY failed_at DESC, failure_id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit)),
            FAILURE_ROW_MAPPER
        );
    }

    public long countFailuresSince(Instant since) {
        Long value = jdbc.queryForObject(
            "SELECT COUNT(*) FROM intake_failures WHERE failed_at >= :since",
            new MapSqlParameterSource().addValue("since", toTimestamp(since)),
            Long.class
        );
        return value == null ? 0L : value;
    }

    public void insertHistory(IngestionHistoryEntry entry) {
        jdbc.update(
            """
                INSERT INTO ingestion_history (
                    intake_id, file_name, file_type, source_kind, status, attempts, records_processed,
                    records_failed, elapsed_ms, error_detail, processed_at
                )
                VALUES (
                    :intakeId, :fileName, :fileType, :sourceKind, :status, :attempts, :recordsProcessed,
                    :recordsFailed, :elapsedMs, :errorDetail, :processedAt
                )
                """,
            new MapSqlParameterSource()
                .addValue("intakeId", entry.intakeId())
                .addValue("fileName", entry.fileName())
                .addValue("fileType", entry.fileType().name())
                .addValue("sourceKind", entry.sourceKind().name())
                .addValue("status", entry.status().name())
                .addValue("attempts", entry.attempts())
                .addValue("recordsProcessed", entry.recordsProcessed())
                .addValue("recordsFailed", entry.recordsFailed())
                .addValue("elapsedMs", entry.elapsedMs())
                .addValue("errorDetail", entry.errorDetail())
                .addValue("processedAt", toTimestamp(entry.processedAt()))
        );
    }

    public List<IngestionHistoryEntry> listHistory(long intakeId) {
        return jdbc.query(
            """
                SELECT history_id, intake_id, file_name, file_type, source_kind, status, attempts,
                       records_processed, records_failed, elapsed_ms, error_detail, processed_at
                FROM ingestion_history
                WHERE intake_id = :intakeId
                ORDER BY processed_at ASC, history_id ASC
                """,
            new MapSqlParameterSource().addValue("intakeId", intakeId),
            HISTORY_ROW_MAPPER
        );
    }

    public int purgeHistory(Instant cutoff) {
        return jdbc.update(
            "DELETE FROM ingestion_history WHERE processed_at < :cutoff",
            new MapSqlParameterSource().addValue("cutoff", toTimestamp(cutoff))
        );
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
