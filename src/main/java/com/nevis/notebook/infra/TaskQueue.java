package com.nevis.notebook.infra;

import com.nevis.notebook.model.QueuedTask;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable, at-least-once queue of processing jobs. A dequeued task stays
 * invisible for the lease and is redelivered if it is not acked in time.
 */
public interface TaskQueue {

    /**
     * Makes the job available for delivery. Enqueueing a job that is already
     * queued does not create a second task.
     */
    void enqueue(UUID jobId);

    Optional<QueuedTask> dequeue(Duration lease);

    void ack(UUID jobId);

    void release(UUID jobId, Duration delay);

    /**
     * Drops a queued task without delivering it.
     */
    default void purge(UUID jobId) {
        ack(jobId);
    }
}
