package com.nevis.notebook.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SourceDocument(
    UUID id,
    UUID ownerId,
    String title,
    String formattedText,
    String summary,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {}
