package com.nevis.notebook.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * One message of a conversation. Turns are append-only; {@code seq} is the
 * strict creation order within the store.
 */
public record ChatTurn(
    UUID id,
    long seq,
    UUID sessionId,
    TurnRole role,
    String content,
    List<SourceReference> sourceRefs,
    OffsetDateTime createdAt
) {

    public ChatTurn withContent(String newContent) {
        return new ChatTurn(id, seq, sessionId, role, newContent, sourceRefs, createdAt);
    }
}
