package com.boardrag.pipeline.repository;

import com.boardrag.pipeline.model.DeferredTask;
import com.boardrag.pipeline.model.TaskStatus;
import com.boardrag.pipeline.model.TaskType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcTaskRepository implements TaskRepository {

    private final JdbcClient jdbcClient;

    private final JsonColumns jsonColumns;

    private final RowMapper<DeferredTask> taskRowMapper = (rs, rowNum) -> {
        String result = rs.getString("result");

        return new DeferredTask(
            rs.getObject("id", UUID.class),
            TaskType.valueOf(rs.getString("task_type")),
            TaskStatus.valueOf(rs.getString("status")),
            JdbcTaskRepository.this.jsonColumns.read(rs.getString("payload")),
            result != null ? JdbcTaskRepository.this.jsonColumns.read(result) : null,
            rs.getString("error"),
            rs.getInt("attempts"),
            rs.getInt("max_attempts"),
            rs.getString("worker"),
            rs.getObject("next_attempt_at", OffsetDateTime.class),
            rs.getObject("created_at", OffsetDateTime.class),
            rs.getObject("started_at", OffsetDateTime.class),
            rs.getObject("finished_at", OffsetDateTime.class)
        );
    };

    @Override
    public DeferredTask create(TaskType type, Map<String, Object> payload, int maxAttempts) {
        return jdbcClient.sql("""
                INSERT INTO deferred_tasks (task_type, payload, max_attempts)
                VALUES (:type, :payload::jsonb, :maxAttempts)
                RETURNING *
                """)
            .param("type", type.name())
            .param("payload", jsonColumns.write(payload))
            .param("maxAttempts", maxAttempts)
            .query(taskRowMapper)
            .single();
    }

    @Override
    public Optional<DeferredTask> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM deferred_tasks WHERE id = :id")
            .param("id", id)
            .query(taskRowMapper)
            .optional();
    }

    @Transactional
    @Override
    public Optional<DeferredTask> claimNext(String worker) {
        String sql = """
            UPDATE deferred_tasks
            SET status = 'STARTED',
                attempts = attempts + 1,
                worker = :worker,
                started_at = NOW(),
                error = NULL
            WHERE id = (
                SELECT id FROM deferred_tasks
                WHERE status = 'PENDING'
                  AND next_attempt_at <= NOW()
                ORDER BY next_attempt_at, created_at
                LIMIT 1 FOR UPDATE SKIP LOCKED
            )
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("worker", worker)
            .query(taskRowMapper)
            .optional();
    }

    @Override
    public boolean markSucceeded(UUID id, Map<String, Object> result) {
        String sql = """
            UPDATE deferred_tasks
            SET status = 'SUCCESS',
                result = :result::jsonb,
                error = NULL,
                finished_at = NOW()
            WHERE id = :id
              AND status = 'STARTED'
            """;

        return jdbcClient.sql(sql)
            .param("result", jsonColumns.write(result))
            .param("id", id)
            .update() > 0;
    }

    @Override
    public boolean markFailed(UUID id, String error) {
        String sql = """
            UPDATE deferred_tasks
            SET status = 'FAILURE',
                error = :error,
                finished_at = NOW()
            WHERE id = :id
              AND status = 'STARTED'
            """;

        return jdbcClient.sql(sql)
            .param("error", error)
            .param("id", id)
            .update() > 0;
    }

    @Override
    public boolean reschedule(UUID id, String error, Duration delay) {
        String sql = """
            UPDATE deferred_tasks
            SET status = 'PENDING',
                error = :error,
                worker = NULL,
                next_attempt_at = NOW() + (INTERVAL '1 millisecond' * :delayMs)
            WHERE id = :id
              AND status = 'STARTED'
            """;

        return jdbcClient.sql(sql)
            .param("error", error)
            .param("delayMs", delay.toMillis())
            .param("id", id)
            .update() > 0;
    }

    @Override
    public Optional<DeferredTask> revoke(UUID id) {
        String sql = """
            UPDATE deferred_tasks
            SET status = 'REVOKED',
                finished_at = NOW()
            WHERE id = :id
              AND status IN ('PENDING', 'STARTED')
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("id", id)
            .query(taskRowMapper)
            .optional();
    }

    @Override
    public List<DeferredTask> findByStatus(TaskStatus status) {
        return jdbcClient.sql("SELECT * FROM deferred_tasks WHERE status = :status ORDER BY started_at NULLS LAST, created_at")
            .param("status", status.name())
            .query(taskRowMapper)
            .list();
    }

    @Override
    public int refreshStarted(Collection<UUID> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        String sql = """
            UPDATE deferred_tasks
            SET started_at = NOW()
            WHERE id IN (:ids)
              AND status = 'STARTED'
            """;

        return jdbcClient.sql(sql)
            .param("ids", ids)
            .update();
    }

    @Override
    public List<UUID> requeueStale(Duration staleAfter) {
        String sql = """
            UPDATE deferred_tasks
            SET status = 'PENDING',
                worker = NULL,
                error = 'Worker stopped responding',
                next_attempt_at = NOW()
            WHERE id IN (
                SELECT id FROM deferred_tasks
                WHERE status = 'STARTED'
                  AND started_at < NOW() - (INTERVAL '1 millisecond' * :staleMs)
                  AND attempts < max_attempts
                FOR UPDATE SKIP LOCKED
            )
            RETURNING id
            """;

        return jdbcClient.sql(sql)
            .param("staleMs", staleAfter.toMillis())
            .query(UUID.class)
            .list();
    }

    @Override
    public List<UUID> failExhaustedStale(Duration staleAfter) {
        String sql = """
            UPDATE deferred_tasks
            SET status = 'FAILURE',
                error = 'Worker stopped responding and no attempts remain',
                finished_at = NOW()
            WHERE id IN (
                SELECT id FROM deferred_tasks
                WHERE status = 'STARTED'
                  AND started_at < NOW() - (INTERVAL '1 millisecond' * :staleMs)
                  AND attempts >= max_attempts
                FOR UPDATE SKIP LOCKED
            )
            RETURNING id
            """;

        return jdbcClient.sql(sql)
            .param("staleMs", staleAfter.toMillis())
            .query(UUID.class)
            .list();
    }
}
