package com.nevis.notebook.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ChatSession(
    UUID id,
    UUID ownerId,
    String title,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {}
