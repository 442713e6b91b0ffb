package com.nevis.notebook.listener;

import com.nevis.notebook.event.JobEnqueuedEvent;
import com.nevis.notebook.worker.ContentQueueWorker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Wakes the worker pool as soon as a job is committed instead of waiting for
 * the next poll.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.pipeline", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ContentEventListener {

    private final ContentQueueWorker contentQueueWorker;

    @Async("pipelineTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleJobEnqueued(JobEnqueuedEvent event) {
        log.debug("Job {} ({}) committed, polling queue", event.jobId(), event.contentType());
        contentQueueWorker.poll();
    }
}
