package com.nevis.notebook.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.notebook.model.ChatTurn;
import com.nevis.notebook.model.TurnRole;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record TurnResponse(
    UUID id,

    TurnRole role,

    String content,

    List<SourceResponse> sources,

    @JsonProperty("created_at")
    OffsetDateTime createdAt
) {
    static TurnResponse from(ChatTurn turn) {
        List<SourceResponse> sources = turn.sourceRefs() == null
            ? List.of()
            : turn.sourceRefs().stream().map(SourceResponse::from).toList();
        return new TurnResponse(turn.id(), turn.role(), turn.content(), sources, turn.createdAt());
    }
}
