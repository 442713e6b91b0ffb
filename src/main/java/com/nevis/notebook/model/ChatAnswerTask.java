package com.nevis.notebook.model;

import java.util.List;
import java.util.UUID;

/**
 * Payload of a {@link ContentType#CHAT_ANSWER} job: everything needed to answer
 * a user turn that is already recorded.
 */
public record ChatAnswerTask(
    UUID ownerId,
    UUID sessionId,
    UUID userTurnId,
    long userTurnSeq,
    String question,
    boolean useRag,
    List<UUID> documentIds
) {}
