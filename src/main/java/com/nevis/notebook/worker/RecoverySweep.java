package com.nevis.notebook.worker;

import com.nevis.notebook.config.PipelineProperties;
import com.nevis.notebook.config.PipelineProperties.Recovery;
import com.nevis.notebook.infra.TaskQueue;
import com.nevis.notebook.model.ContentType;
import com.nevis.notebook.model.JobStatus;
import com.nevis.notebook.model.ProcessingJob;
import com.nevis.notebook.repository.ProcessingJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Repairs jobs left behind by a previous process. Runs once before the worker
 * pool takes its first task.
 * <p>
 * Resumable content types go back to {@code PENDING} and are queued again when
 * their raw input is still stored and they are within their max age. Every
 * other interrupted job is failed. Jobs of non-resumable types (interactive
 * answers) are never resumed: pending or processing, they are failed and their
 * queued task dropped, since answering later would use stale context.
 */
@Slf4j
@Component
public class RecoverySweep {

    static final String RESTART_FAILURE = "Interrupted by a server restart, please ask again";
    static final String NO_INPUT_FAILURE = "Recovery failed: raw input is no longer available";
    static final String EXPIRED_FAILURE = "Recovery failed: job is older than ";

    private final ProcessingJobRepository jobRepository;
    private final TaskQueue taskQueue;
    private final PipelineProperties pipelineProperties;
    private final Map<ContentType, JobHandler> handlers = new EnumMap<>(ContentType.class);

    public RecoverySweep(
        ProcessingJobRepository jobRepository,
        TaskQueue taskQueue,
        PipelineProperties pipelineProperties,
        List<JobHandler> jobHandlers
    ) {
        this.jobRepository = jobRepository;
        this.taskQueue = taskQueue;
        this.pipelineProperties = pipelineProperties;
        jobHandlers.forEach(handler -> handlers.put(handler.contentType(), handler));
    }

    public RecoveryReport sweep() {
        OffsetDateTime now = OffsetDateTime.now();
        int resumed = 0;
        int failed = 0;

        for (ContentType type : ContentType.values()) {
            Recovery policy = pipelineProperties.recoveryFor(type);

            for (ProcessingJob job : jobRepository.findByStatus(type, JobStatus.PROCESSING)) {
                if (recoverInterrupted(job, policy, now)) {
                    resumed++;
                } else {
                    failed++;
                }
            }

            if (!policy.resume()) {
                for (ProcessingJob job : jobRepository.findByStatus(type, JobStatus.PENDING)) {
                    if (jobRepository.transition(job.id(), JobStatus.PENDING, JobStatus.FAILED, RESTART_FAILURE)) {
                        failed++;
                    }
                    taskQueue.purge(job.id());
                }
            }
        }

        if (resumed > 0 || failed > 0) {
            log.info("Recovery sweep: {} jobs resumed, {} jobs failed", resumed, failed);
        } else {
            log.debug("Recovery sweep: nothing to repair");
        }
        return new RecoveryReport(resumed, failed);
    }

    private boolean recoverInterrupted(ProcessingJob job, Recovery policy, OffsetDateTime now) {
        String failure = null;
        if (!policy.resume()) {
            failure = RESTART_FAILURE;
        } else if (policy.isExpired(job.queuedAt(), now)) {
            failure = EXPIRED_FAILURE + policy.maxAge();
        } else if (!hasRetainedInput(job)) {
            failure = NO_INPUT_FAILURE;
        }

        if (failure != null) {
            jobRepository.transition(job.id(), JobStatus.PROCESSING, JobStatus.FAILED, failure);
            taskQueue.purge(job.id());
            log.warn("Recovery: job {} ({}, item {}) failed: {}", job.id(), job.contentType(), job.itemId(), failure);
            return false;
        }

        if (!jobRepository.transition(job.id(), JobStatus.PROCESSING, JobStatus.PENDING, null)) {
            log.info("Recovery: job {} changed status concurrently, left alone", job.id());
            return false;
        }
        taskQueue.enqueue(job.id());
        log.info("Recovery: job {} ({}, item {}) reset to PENDING and re-queued", job.id(), job.contentType(), job.itemId());
        return true;
    }

    private boolean hasRetainedInput(ProcessingJob job) {
        JobHandler handler = handlers.get(job.contentType());
        return handler != null && handler.hasRetainedInput(job);
    }
}
