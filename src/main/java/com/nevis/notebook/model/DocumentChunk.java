package com.nevis.notebook.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record DocumentChunk(
    UUID id,
    UUID documentId,
    int chunkIndex,
    Integer pageNumber,
    String content,
    boolean embedded,
    OffsetDateTime createdAt
) {}
