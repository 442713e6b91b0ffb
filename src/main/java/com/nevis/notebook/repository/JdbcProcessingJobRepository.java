package com.nevis.notebook.repository;

import com.nevis.notebook.model.ContentType;
import com.nevis.notebook.model.JobStatus;
import com.nevis.notebook.model.ProcessingJob;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcProcessingJobRepository implements ProcessingJobRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<ProcessingJob> jobRowMapper = (rs, rowNum) -> new ProcessingJob(
        rs.getObject("id", UUID.class),
        ContentType.valueOf(rs.getString("content_type")),
        rs.getObject("item_id", UUID.class),
        JobStatus.valueOf(rs.getString("status")),
        rs.getString("error_message"),
        rs.getInt("retry_count"),
        rs.getString("payload"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class),
        rs.getObject("queued_at", OffsetDateTime.class)
    );

    @Override
    public ProcessingJob create(ContentType contentType, UUID itemId, String payload) {
        return jdbcClient.sql("""
                INSERT INTO processing_jobs (content_type, item_id, status, payload)
                VALUES (:contentType, :itemId, :status, CAST(:payload AS jsonb))
                RETURNING *
                """)
            .param("contentType", contentType.name())
            .param("itemId", itemId)
            .param("status", JobStatus.PENDING.name())
            .param("payload", payload)
            .query(jobRowMapper)
            .single();
    }

    @Override
    public Optional<ProcessingJob> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM processing_jobs WHERE id = :id")
            .param("id", id)
            .query(jobRowMapper)
            .optional();
    }

    @Override
    public Optional<ProcessingJob> findByItem(ContentType contentType, UUID itemId) {
        return jdbcClient.sql("""
                SELECT * FROM processing_jobs
                WHERE content_type = :contentType
                  AND item_id = :itemId
                """)
            .param("contentType", contentType.name())
            .param("itemId", itemId)
            .query(jobRowMapper)
            .optional();
    }

    @Override
    public List<ProcessingJob> findByStatus(ContentType contentType, JobStatus status) {
        return jdbcClient.sql("""
                SELECT * FROM processing_jobs
                WHERE content_type = :contentType
                  AND status = :status
                ORDER BY created_at ASC
                """)
            .param("contentType", contentType.name())
            .param("status", status.name())
            .query(jobRowMapper)
            .list();
    }

    @Override
    public boolean transition(UUID id, JobStatus from, JobStatus to, String errorMessage) {
        from.checkTransition(to);

        String sql = """
            UPDATE processing_jobs
            SET status = :to,
                error_message = :error,
                updated_at = NOW(),
                queued_at = CASE WHEN :to = 'PENDING' THEN NOW() ELSE queued_at END
            WHERE id = :id
              AND status = :from
            """;

        int rowsAffected = jdbcClient.sql(sql)
            .param("to", to.name())
            .param("error", errorMessage)
            .param("id", id)
            .param("from", from.name())
            .update();

        return rowsAffected == 1;
    }

    @Override
    public void incrementRetryCount(UUID id) {
        jdbcClient.sql("""
                UPDATE processing_jobs
                SET retry_count = retry_count + 1,
                    updated_at = NOW()
                WHERE id = :id
                """)
            .param("id", id)
            .update();
    }
}
