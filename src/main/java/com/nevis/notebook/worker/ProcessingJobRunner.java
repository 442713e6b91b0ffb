package com.nevis.notebook.worker;

import com.nevis.notebook.config.PipelineProperties;
import com.nevis.notebook.infra.TaskQueue;
import com.nevis.notebook.model.ContentType;
import com.nevis.notebook.model.JobStatus;
import com.nevis.notebook.model.ProcessingJob;
import com.nevis.notebook.repository.ProcessingJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Executes one delivered job: claim it, run its handler with retries for backend
 * outages, record the outcome, ack the task.
 */
@Slf4j
@Component
public class ProcessingJobRunner {

    private final ProcessingJobRepository jobRepository;
    private final TaskQueue taskQueue;
    private final RetryTemplate retryTemplate;
    private final PipelineProperties pipelineProperties;
    private final Map<ContentType, JobHandler> handlers = new EnumMap<>(ContentType.class);

    public ProcessingJobRunner(
        ProcessingJobRepository jobRepository,
        TaskQueue taskQueue,
        @Qualifier("pipelineRetryTemplate") RetryTemplate retryTemplate,
        PipelineProperties pipelineProperties,
        List<JobHandler> jobHandlers
    ) {
        this.jobRepository = jobRepository;
        this.taskQueue = taskQueue;
        this.retryTemplate = retryTemplate;
        this.pipelineProperties = pipelineProperties;
        jobHandlers.forEach(handler -> handlers.put(handler.contentType(), handler));
    }

    public JobHandler handlerFor(ContentType contentType) {
        JobHandler handler = handlers.get(contentType);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for " + contentType);
        }
        return handler;
    }

    public void run(UUID jobId) {
        Optional<ProcessingJob> found = jobRepository.findById(jobId);
        if (found.isEmpty()) {
            log.warn("Job {} no longer exists, dropping its task", jobId);
            taskQueue.ack(jobId);
            return;
        }

        ProcessingJob job = found.get();
        PipelineProperties.Recovery policy = pipelineProperties.recoveryFor(job.contentType());
        if (job.status() == JobStatus.PENDING && policy.isExpired(job.queuedAt(), OffsetDateTime.now())) {
            log.warn("Job {} ({}) expired before it was processed", jobId, job.contentType());
            jobRepository.transition(jobId, JobStatus.PENDING, JobStatus.FAILED,
                "Expired before processing, older than " + policy.maxAge());
            taskQueue.ack(jobId);
            return;
        }

        if (!jobRepository.transition(jobId, JobStatus.PENDING, JobStatus.PROCESSING, null)) {
            log.info("Job {} is {} and not claimable, skipping duplicate delivery", jobId, job.status());
            taskQueue.ack(jobId);
            return;
        }

        log.info("Job {} ({}, item {}) claimed", jobId, job.contentType(), job.itemId());
        JobHandler handler = handlerFor(job.contentType());

        try {
            retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    jobRepository.incrementRetryCount(jobId);
                    log.warn("Job {}: retry {} after: {}", jobId, context.getRetryCount(),
                        context.getLastThrowable() == null ? "?" : context.getLastThrowable().getMessage());
                }
                handler.handle(job);
                return null;
            });

            if (jobRepository.transition(jobId, JobStatus.PROCESSING, JobStatus.COMPLETED, null)) {
                log.info("Job {} completed", jobId);
            } else {
                log.warn("Job {} finished but was no longer PROCESSING", jobId);
            }
        } catch (Exception e) {
            log.error("Job {} FAILED: {}", jobId, e.getMessage(), e);
            jobRepository.transition(jobId, JobStatus.PROCESSING, JobStatus.FAILED, errorText(e));
        } finally {
            taskQueue.ack(jobId);
        }
    }

    private static String errorText(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
