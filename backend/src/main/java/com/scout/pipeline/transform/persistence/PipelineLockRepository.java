package com.scout.pipeline.transform.persistence;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Named mutex rows. A lock is free when it has no owner or its lease expired; acquisition is a
 * conditional update so at most one caller wins.
 */
@Repository
public class PipelineLockRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public PipelineLockRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean tryAcquire(String lockName, String owner, Instant now, Instant expiresAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("lockName", lockName)
            .addValue("owner", owner)
            .addValue("now", Timestamp.from(now))
            .addValue("expiresAt", Timestamp.from(expiresAt));
        int updated = jdbc.update(
            """
                UPDATE pipeline_locks
                SET owner = :owner,
                    acquired_at = :now,
                    expires_at = :expiresAt
                WHERE lock_name = :lockName
                  AND (owner IS NULL OR expires_at IS NULL OR expires_at < :now)
                """,
            params
        );
        if (updated > 0) {
            return true;
        }
        if (exists(lockName)) {
            return false;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO pipeline_locks (lock_name, owner, acquired_at, expires_at)
                    VALUES (:lockName, :owner, :now, :expiresAt)
                    """,
                params
            );
            return true;
        } catch (DataIntegrityViolationException e) {
            return false;
        }
    }

    public boolean release(String lockName, String owner) {
        return jdbc.update(
            """
                UPDATE pipeline_locks
                SET owner = NULL,
                    acquired_at = NULL,
                    expires_at = NULL
                WHERE lock_name = :lockName
                  AND owner = :owner
                """,
            new MapSqlParameterSource()
                .addValue("lockName", lockName)
                .addValue("owner", owner)
        ) > 0;
    }

    public Optional<String> findOwner(String lockName) {
        List<String> owners = jdbc.queryForList(
            "SELECT owner FROM pipeline_locks WHERE lock_name = :lockName AND owner IS NOT NULL",
            new MapSqlParameterSource().addValue("lockName", lockName),
            String.class
        );
        return owners.stream().findFirst();
    }

    private boolean exists(String lockName) {
        Long value = jdbc.queryForObject(
            "SELECT COUNT(*) FROM pipeline_locks WHERE lock_name = :lockName",
            new MapSqlParameterSource().addValue("lockName", lockName),
            Long.class
        );
        return value != null && value > 0;
    }
}
