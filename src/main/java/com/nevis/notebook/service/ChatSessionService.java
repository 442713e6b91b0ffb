package com.nevis.notebook.service;

import com.nevis.notebook.model.ChatSession;
import com.nevis.notebook.model.ChatTurn;
import com.nevis.notebook.model.ProcessingJob;

import java.util.List;
import java.util.UUID;

public interface ChatSessionService {

    ChatSession create(UUID ownerId, String title);

    /**
     * @throws com.nevis.notebook.exception.EntityNotFoundException when the session does not exist
     * @throws com.nevis.notebook.exception.AuthorizationException when it belongs to someone else
     */
    ChatSession requireOwned(UUID ownerId, UUID sessionId);

    List<ChatTurn> turns(UUID ownerId, UUID sessionId);

    ProcessingJob answerJob(UUID ownerId, UUID sessionId, UUID jobId);
}
