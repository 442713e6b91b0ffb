package com.nevis.notebook.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.notebook.model.SourceDocument;

import java.time.OffsetDateTime;
import java.util.UUID;

public record DocumentResponse(
    UUID id,

    @JsonProperty("owner_id")
    UUID ownerId,

    String title,

    @JsonProperty("formatted_text")
    String formattedText,

    String summary,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt
) {
    static DocumentResponse from(SourceDocument document) {
        return new DocumentResponse(
            document.id(),
            document.ownerId(),
            document.title(),
            document.formattedText(),
            document.summary(),
            document.createdAt(),
            document.updatedAt());
    }
}
