package com.nevis.notebook.service;

import com.nevis.notebook.exception.AuthorizationException;
import com.nevis.notebook.exception.EntityNotFoundException;
import com.nevis.notebook.model.ChatAnswerTask;
import com.nevis.notebook.model.ChatSession;
import com.nevis.notebook.model.ChatTurn;
import com.nevis.notebook.model.ContentType;
import com.nevis.notebook.model.ProcessingJob;
import com.nevis.notebook.repository.ChatSessionRepository;
import com.nevis.notebook.repository.ProcessingJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChatSessionServiceImpl implements ChatSessionService {

    private final ChatSessionRepository sessionRepository;
    private final ProcessingJobRepository jobRepository;
    private final ConversationHistoryService historyService;
    private final JobPayloadCodec payloadCodec;

    @Override
    public ChatSession create(UUID ownerId, String title) {
        ChatSession session = sessionRepository.save(ownerId, title);
        log.info("Created chat session {} for owner {}", session.id(), ownerId);
        return session;
    }

    @Override
    public ChatSession requireOwned(UUID ownerId, UUID sessionId) {
        ChatSession session = sessionRepository.findById(sessionId)
            .orElseThrow(() -> new EntityNotFoundException("Chat session", sessionId));

        if (!session.ownerId().equals(ownerId)) {
            log.warn("SECURITY: owner {} tried to use chat session {} of owner {}",
                ownerId, sessionId, session.ownerId());
            throw new AuthorizationException("Chat session is not accessible", ownerId);
        }
        return session;
    }

    @Override
    public List<ChatTurn> turns(UUID ownerId, UUID sessionId) {
        requireOwned(ownerId, sessionId);
        return historyService.history(sessionId);
    }

    @Override
    public ProcessingJob answerJob(UUID ownerId, UUID sessionId, UUID jobId) {
        requireOwned(ownerId, sessionId);

        ProcessingJob job = jobRepository.findById(jobId)
            .filter(found -> found.contentType() == ContentType.CHAT_ANSWER)
            .orElseThrow(() -> new EntityNotFoundException("Answer job", jobId));

        ChatAnswerTask task = payloadCodec.read(job.payload(), ChatAnswerTask.class);
        if (!sessionId.equals(task.sessionId())) {
            throw new EntityNotFoundException("Answer job", jobId);
        }
        return job;
    }
}
