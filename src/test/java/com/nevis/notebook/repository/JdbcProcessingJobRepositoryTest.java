package com.nevis.notebook.repository;

import com.nevis.notebook.exception.InvalidStatusTransitionException;
import com.nevis.notebook.model.ContentType;
import com.nevis.notebook.model.JobStatus;
import com.nevis.notebook.model.ProcessingJob;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.test.annotation.DirtiesContext;

import java.time.OffsetDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class JdbcProcessingJobRepositoryTest extends BaseIntegrationTest {

    @Autowired
    private ProcessingJobRepository jobRepository;

    @Autowired
    private JdbcClient jdbcClient;

    @Test
    @DisplayName("A new job is PENDING with no retries")
    void shouldCreatePendingJob() {
        UUID itemId = UUID.randomUUID();

        ProcessingJob job = jobRepository.create(ContentType.CHAT_ANSWER, itemId, "{\"question\": \"Hi\"}");

        assertThat(job.status()).isEqualTo(JobStatus.PENDING);
        assertThat(job.retryCount()).isZero();
        assertThat(job.payload()).contains("\"question\"");
        assertThat(jobRepository.findByItem(ContentType.CHAT_ANSWER, itemId)).get()
            .extracting(ProcessingJob::id).isEqualTo(job.id());
    }

    @Test
    @DisplayName("An item has at most one job per content type")
    void shouldRejectSecondJobForItem() {
        UUID itemId = UUID.randomUUID();
        jobRepository.create(ContentType.DOCUMENT, itemId, null);

        assertThatThrownBy(() -> jobRepository.create(ContentType.DOCUMENT, itemId, null))
            .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Only one of two competing claims wins")
    void shouldCompareAndSet() {
        ProcessingJob job = jobRepository.create(ContentType.DOCUMENT, UUID.randomUUID(), null);

        assertThat(jobRepository.transition(job.id(), JobStatus.PENDING, JobStatus.PROCESSING, null)).isTrue();
        assertThat(jobRepository.transition(job.id(), JobStatus.PENDING, JobStatus.PROCESSING, null)).isFalse();
        assertThat(jobRepository.findById(job.id())).get()
            .extracting(ProcessingJob::status).isEqualTo(JobStatus.PROCESSING);
    }

    @Test
    @DisplayName("A failure keeps its message and a retry clears it")
    void shouldRecordAndClearError() {
        ProcessingJob job = jobRepository.create(ContentType.DOCUMENT, UUID.randomUUID(), null);
        jobRepository.transition(job.id(), JobStatus.PENDING, JobStatus.PROCESSING, null);
        jobRepository.transition(job.id(), JobStatus.PROCESSING, JobStatus.FAILED, "Embedding backend timed out");
        jobRepository.incrementRetryCount(job.id());

        ProcessingJob failed = jobRepository.findById(job.id()).orElseThrow();
        assertThat(failed.errorMessage()).isEqualTo("Embedding backend timed out");
        assertThat(failed.retryCount()).isEqualTo(1);

        jobRepository.transition(job.id(), JobStatus.FAILED, JobStatus.PENDING, null);
        assertThat(jobRepository.findById(job.id()).orElseThrow().errorMessage()).isNull();
    }

    @Test
    @DisplayName("Re-entering PENDING restarts the queued clock, other moves keep it")
    void shouldRestartQueuedClockOnRequeue() {
        ProcessingJob job = jobRepository.create(ContentType.DOCUMENT, UUID.randomUUID(), null);
        jdbcClient.sql("""
                UPDATE processing_jobs
                SET created_at = NOW() - INTERVAL '30 days',
                    queued_at = NOW() - INTERVAL '30 days'
                WHERE id = :id
                """)
            .param("id", job.id())
            .update();
        jobRepository.transition(job.id(), JobStatus.PENDING, JobStatus.PROCESSING, null);
        jobRepository.transition(job.id(), JobStatus.PROCESSING, JobStatus.COMPLETED, null);

        ProcessingJob completed = jobRepository.findById(job.id()).orElseThrow();
        assertThat(completed.queuedAt()).isBefore(OffsetDateTime.now().minusDays(29));

        jobRepository.transition(job.id(), JobStatus.COMPLETED, JobStatus.PENDING, null);

        ProcessingJob requeued = jobRepository.findById(job.id()).orElseThrow();
        assertThat(requeued.createdAt()).isBefore(OffsetDateTime.now().minusDays(29));
        assertThat(requeued.queuedAt()).isAfter(OffsetDateTime.now().minusMinutes(1));
    }

    @Test
    @DisplayName("An illegal move is refused before touching the row")
    void shouldRejectIllegalTransition() {
        ProcessingJob job = jobRepository.create(ContentType.DOCUMENT, UUID.randomUUID(), null);

        assertThatThrownBy(() -> jobRepository.transition(job.id(), JobStatus.PENDING, JobStatus.COMPLETED, null))
            .isInstanceOf(InvalidStatusTransitionException.class);
        assertThat(jobRepository.findById(job.id()).orElseThrow().status()).isEqualTo(JobStatus.PENDING);
    }

    @Test
    @DisplayName("Jobs are found by type and status")
    void shouldFindByStatus() {
        ProcessingJob job = jobRepository.create(ContentType.DOCUMENT, UUID.randomUUID(), null);
        jobRepository.transition(job.id(), JobStatus.PENDING, JobStatus.PROCESSING, null);

        assertThat(jobRepository.findByStatus(ContentType.DOCUMENT, JobStatus.PROCESSING))
            .extracting(ProcessingJob::id).contains(job.id());
        assertThat(jobRepository.findByStatus(ContentType.CHAT_ANSWER, JobStatus.PROCESSING))
            .extracting(ProcessingJob::id).doesNotContain(job.id());
    }
}
