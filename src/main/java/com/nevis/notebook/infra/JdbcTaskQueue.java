package com.nevis.notebook.infra;

import com.nevis.notebook.model.QueuedTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcTaskQueue implements TaskQueue {

    private final JdbcClient jdbcClient;

    private final RowMapper<QueuedTask> taskRowMapper = (rs, rowNum) -> new QueuedTask(
        rs.getObject("job_id", UUID.class),
        rs.getInt("delivery_count"),
        rs.getObject("enqueued_at", OffsetDateTime.class)
    );

    @Override
    public void enqueue(UUID jobId) {
        jdbcClient.sql("""
                INSERT INTO task_queue (job_id, available_at)
                VALUES (:jobId, NOW())
                ON CONFLICT (job_id) DO UPDATE
                SET available_at = NOW(),
                    locked_until = NULL
                """)
            .param("jobId", jobId)
            .update();

        log.debug("Enqueued job {}", jobId);
    }

    @Override
    @Transactional
    public Optional<QueuedTask> dequeue(Duration lease) {
        String sql = """
            UPDATE task_queue
            SET locked_until = NOW() + (INTERVAL '1 millisecond' * :leaseMs),
                delivery_count = delivery_count + 1
            WHERE job_id = (
                SELECT job_id FROM task_queue
                WHERE available_at <= NOW()
                  AND (locked_until IS NULL OR locked_until < NOW())
                ORDER BY available_at ASC
                LIMIT 1 FOR UPDATE SKIP LOCKED
            )
            RETURNING job_id, delivery_count, enqueued_at
            """;

        return jdbcClient.sql(sql)
            .param("leaseMs", lease.toMillis())
            .query(taskRowMapper)
            .optional();
    }

    @Override
    public void ack(UUID jobId) {
        jdbcClient.sql("DELETE FROM task_queue WHERE job_id = :jobId")
            .param("jobId", jobId)
            .update();
    }

    @Override
    public void release(UUID jobId, Duration delay) {
        jdbcClient.sql("""
                UPDATE task_queue
                SET locked_until = NULL,
                    available_at = NOW() + (INTERVAL '1 millisecond' * :delayMs)
                WHERE job_id = :jobId
                """)
            .param("delayMs", delay.toMillis())
            .param("jobId", jobId)
            .update();
    }
}
