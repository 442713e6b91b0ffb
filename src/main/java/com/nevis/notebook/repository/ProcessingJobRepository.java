package com.nevis.notebook.repository;

import com.nevis.notebook.model.ContentType;
import com.nevis.notebook.model.JobStatus;
import com.nevis.notebook.model.ProcessingJob;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProcessingJobRepository {

    ProcessingJob create(ContentType contentType, UUID itemId, String payload);

    Optional<ProcessingJob> findById(UUID id);

    Optional<ProcessingJob> findByItem(ContentType contentType, UUID itemId);

    List<ProcessingJob> findByStatus(ContentType contentType, JobStatus status);

    /**
     * Compare-and-set status change. Returns {@code false} when the job is no
     * longer in {@code from}; throws when {@code from -> to} is not a legal move.
     */
    boolean transition(UUID id, JobStatus from, JobStatus to, String errorMessage);

    void incrementRetryCount(UUID id);
}
