package com.nevis.notebook.repository;

import com.nevis.notebook.model.ChatSession;

import java.util.Optional;
import java.util.UUID;

public interface ChatSessionRepository {

    ChatSession save(UUID ownerId, String title);

    Optional<ChatSession> findById(UUID id);

    void touch(UUID id);
}
