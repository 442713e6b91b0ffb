package com.nevis.notebook.worker;

import com.nevis.notebook.config.PipelineProperties;
import com.nevis.notebook.infra.TaskQueue;
import com.nevis.notebook.model.QueuedTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded worker pool over the task queue. Takes a task only when one of its
 * {@code workers} slots is free.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.pipeline", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ContentQueueWorker {

    private final TaskQueue taskQueue;
    private final ProcessingJobRunner jobRunner;
    private final RecoverySweep recoverySweep;
    private final Executor executor;
    private final PipelineProperties pipelineProperties;
    private final Semaphore slots;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public ContentQueueWorker(
        TaskQueue taskQueue,
        ProcessingJobRunner jobRunner,
        RecoverySweep recoverySweep,
        @Qualifier("pipelineTaskExecutor") Executor executor,
        PipelineProperties pipelineProperties
    ) {
        this.taskQueue = taskQueue;
        this.jobRunner = jobRunner;
        this.recoverySweep = recoverySweep;
        this.executor = executor;
        this.pipelineProperties = pipelineProperties;
        this.slots = new Semaphore(pipelineProperties.workers());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        recoverySweep.sweep();
        started.set(true);
        log.info("Content pipeline started with {} workers", pipelineProperties.workers());
        poll();
    }

    @Scheduled(fixedDelayString = "${app.pipeline.poll-interval-ms:1000}")
    public void poll() {
        if (!started.get()) {
            return;
        }

        while (slots.tryAcquire()) {
            Optional<QueuedTask> task;
            try {
                task = taskQueue.dequeue(pipelineProperties.lease());
            } catch (RuntimeException e) {
                slots.release();
                throw e;
            }

            if (task.isEmpty()) {
                slots.release();
                return;
            }
            dispatch(task.get());
        }
    }

    public boolean isStarted() {
        return started.get();
    }

    private void dispatch(QueuedTask task) {
        log.debug("Dispatching job {} (delivery {})", task.jobId(), task.deliveryCount());
        try {
            executor.execute(() -> {
                try {
                    jobRunner.run(task.jobId());
                } catch (RuntimeException e) {
                    log.error("Job {} aborted, task will be redelivered after its lease: {}",
                        task.jobId(), e.getMessage(), e);
                } finally {
                    slots.release();
                }
            });
        } catch (TaskRejectedException e) {
            slots.release();
            log.warn("Worker pool rejected job {}, returning it to the queue", task.jobId());
            taskQueue.release(task.jobId(), Duration.ZERO);
        }
    }
}
