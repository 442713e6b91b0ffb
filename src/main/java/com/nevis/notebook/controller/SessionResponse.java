package com.nevis.notebook.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.notebook.model.ChatSession;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SessionResponse(
    UUID id,

    @JsonProperty("owner_id")
    UUID ownerId,

    String title,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt
) {
    static SessionResponse from(ChatSession session) {
        return new SessionResponse(
            session.id(),
            session.ownerId(),
            session.title(),
            session.createdAt(),
            session.updatedAt());
    }
}
