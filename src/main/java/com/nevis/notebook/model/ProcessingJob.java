package com.nevis.notebook.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ProcessingJob(
    UUID id,
    ContentType contentType,
    UUID itemId,
    JobStatus status,
    String errorMessage,
    int retryCount,
    String payload,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt,
    OffsetDateTime queuedAt
) {}
