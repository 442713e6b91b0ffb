package com.nevis.notebook.worker;

import com.nevis.notebook.config.PipelineProperties;
import com.nevis.notebook.exception.BackendUnavailableException;
import com.nevis.notebook.exception.ProcessingFailedException;
import com.nevis.notebook.infra.TaskQueue;
import com.nevis.notebook.model.ContentType;
import com.nevis.notebook.model.JobStatus;
import com.nevis.notebook.model.ProcessingJob;
import com.nevis.notebook.repository.ProcessingJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProcessingJobRunnerTest {

    @Mock
    private ProcessingJobRepository jobRepository;

    @Mock
    private TaskQueue taskQueue;

    @Mock
    private JobHandler documentHandler;

    private ProcessingJobRunner runner;

    private final UUID jobId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        when(documentHandler.contentType()).thenReturn(ContentType.DOCUMENT);

        RetryTemplate retryTemplate = RetryTemplate.builder()
            .maxAttempts(3)
            .fixedBackoff(1)
            .retryOn(BackendUnavailableException.class)
            .traversingCauses()
            .build();

        PipelineProperties properties = new PipelineProperties(
            true, 2, 1000L, Duration.ofMinutes(10), 200000, 8000, 0.2, true,
            new PipelineProperties.Retry(3, Duration.ofMillis(1), 2.0, Duration.ofMillis(10)),
            Map.of(
                ContentType.DOCUMENT, new PipelineProperties.Recovery(true, Duration.ofDays(7)),
                ContentType.CHAT_ANSWER, new PipelineProperties.Recovery(false, Duration.ofMinutes(5))));

        runner = new ProcessingJobRunner(jobRepository, taskQueue, retryTemplate, properties, List.of(documentHandler));
    }

    @Test
    @DisplayName("A task whose job is gone is acked and dropped")
    void shouldDropTaskOfMissingJob() {
        when(jobRepository.findById(jobId)).thenReturn(Optional.empty());

        runner.run(jobId);

        verify(taskQueue).ack(jobId);
        verify(jobRepository, never()).transition(any(), any(), any(), any());
    }

    @Test
    @DisplayName("A pending job past its max age fails without running")
    void shouldExpireStaleJob() {
        ProcessingJob stale = job(JobStatus.PENDING, OffsetDateTime.now().minusDays(8));
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(stale));

        runner.run(jobId);

        verify(jobRepository).transition(eq(jobId), eq(JobStatus.PENDING), eq(JobStatus.FAILED),
            startsWith("Expired before processing"));
        verify(documentHandler, never()).handle(any());
        verify(taskQueue).ack(jobId);
    }

    @Test
    @DisplayName("A document retried long after it was created is run, its age counts from the retry")
    void shouldRunOldDocumentRequeuedByRetry() {
        ProcessingJob retried = job(JobStatus.PENDING, OffsetDateTime.now().minusDays(30), OffsetDateTime.now());
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(retried));
        when(jobRepository.transition(jobId, JobStatus.PENDING, JobStatus.PROCESSING, null)).thenReturn(true);
        when(jobRepository.transition(jobId, JobStatus.PROCESSING, JobStatus.COMPLETED, null)).thenReturn(true);

        runner.run(jobId);

        verify(documentHandler).handle(retried);
        verify(jobRepository, never()).transition(eq(jobId), eq(JobStatus.PENDING), eq(JobStatus.FAILED), any());
        verify(jobRepository).transition(jobId, JobStatus.PROCESSING, JobStatus.COMPLETED, null);
    }

    @Test
    @DisplayName("A duplicate delivery that cannot claim the job is skipped")
    void shouldSkipUnclaimableJob() {
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job(JobStatus.PROCESSING, OffsetDateTime.now())));
        when(jobRepository.transition(jobId, JobStatus.PENDING, JobStatus.PROCESSING, null)).thenReturn(false);

        runner.run(jobId);

        verify(documentHandler, never()).handle(any());
        verify(taskQueue).ack(jobId);
    }

    @Test
    @DisplayName("A successful run completes the job")
    void shouldCompleteJob() {
        ProcessingJob job = job(JobStatus.PENDING, OffsetDateTime.now());
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));
        when(jobRepository.transition(jobId, JobStatus.PENDING, JobStatus.PROCESSING, null)).thenReturn(true);
        when(jobRepository.transition(jobId, JobStatus.PROCESSING, JobStatus.COMPLETED, null)).thenReturn(true);

        runner.run(jobId);

        verify(documentHandler).handle(job);
        verify(jobRepository).transition(jobId, JobStatus.PROCESSING, JobStatus.COMPLETED, null);
        verify(jobRepository, never()).incrementRetryCount(any());
        verify(taskQueue).ack(jobId);
    }

    @Test
    @DisplayName("A backend outage is retried and counted")
    void shouldRetryTransientFailure() {
        ProcessingJob job = job(JobStatus.PENDING, OffsetDateTime.now());
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));
        when(jobRepository.transition(jobId, JobStatus.PENDING, JobStatus.PROCESSING, null)).thenReturn(true);
        when(jobRepository.transition(jobId, JobStatus.PROCESSING, JobStatus.COMPLETED, null)).thenReturn(true);
        doThrow(new BackendUnavailableException(BackendUnavailableException.Backend.EMBEDDING, "timeout", null))
            .doNothing()
            .when(documentHandler).handle(job);

        runner.run(jobId);

        verify(documentHandler, times(2)).handle(job);
        verify(jobRepository, times(1)).incrementRetryCount(jobId);
        verify(jobRepository).transition(jobId, JobStatus.PROCESSING, JobStatus.COMPLETED, null);
    }

    @Test
    @DisplayName("Retries stop after the configured attempts and the job fails")
    void shouldFailAfterRetriesExhausted() {
        ProcessingJob job = job(JobStatus.PENDING, OffsetDateTime.now());
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));
        when(jobRepository.transition(jobId, JobStatus.PENDING, JobStatus.PROCESSING, null)).thenReturn(true);
        doThrow(new BackendUnavailableException(BackendUnavailableException.Backend.EMBEDDING, "connection refused", null))
            .when(documentHandler).handle(job);

        runner.run(jobId);

        verify(documentHandler, times(3)).handle(job);
        verify(jobRepository).transition(jobId, JobStatus.PROCESSING, JobStatus.FAILED, "connection refused");
        verify(taskQueue).ack(jobId);
    }

    @Test
    @DisplayName("A permanent failure is not retried")
    void shouldFailPermanentErrorImmediately() {
        ProcessingJob job = job(JobStatus.PENDING, OffsetDateTime.now());
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));
        when(jobRepository.transition(jobId, JobStatus.PENDING, JobStatus.PROCESSING, null)).thenReturn(true);
        doThrow(new ProcessingFailedException("Raw input is not available")).when(documentHandler).handle(job);

        runner.run(jobId);

        verify(documentHandler, times(1)).handle(job);
        verify(jobRepository).transition(jobId, JobStatus.PROCESSING, JobStatus.FAILED, "Raw input is not available");
        verify(taskQueue).ack(jobId);
    }

    @Test
    @DisplayName("An unknown content type has no handler")
    void shouldRefuseUnknownType() {
        assertThat(runner.handlerFor(ContentType.DOCUMENT)).isSameAs(documentHandler);
        assertThatThrownBy(() -> runner.handlerFor(ContentType.CHAT_ANSWER))
            .isInstanceOf(IllegalStateException.class);
    }

    private ProcessingJob job(JobStatus status, OffsetDateTime createdAt) {
        return job(status, createdAt, createdAt);
    }

    private ProcessingJob job(JobStatus status, OffsetDateTime createdAt, OffsetDateTime queuedAt) {
        return new ProcessingJob(jobId, ContentType.DOCUMENT, UUID.randomUUID(), status, null, 0, null,
            createdAt, queuedAt, queuedAt);
    }
}
