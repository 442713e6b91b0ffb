package com.nevis.notebook.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.notebook.model.ContentType;
import com.nevis.notebook.model.JobStatus;
import com.nevis.notebook.model.ProcessingJob;

import java.time.OffsetDateTime;
import java.util.UUID;

public record JobResponse(
    UUID id,

    @JsonProperty("content_type")
    ContentType contentType,

    @JsonProperty("item_id")
    UUID itemId,

    JobStatus status,

    @JsonProperty("error_message")
    String errorMessage,

    @JsonProperty("retry_count")
    int retryCount,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt
) {
    static JobResponse from(ProcessingJob job) {
        return new JobResponse(
            job.id(),
            job.contentType(),
            job.itemId(),
            job.status(),
            job.errorMessage(),
            job.retryCount(),
            job.createdAt(),
            job.updatedAt());
    }
}
