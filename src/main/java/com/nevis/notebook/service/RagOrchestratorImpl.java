package com.nevis.notebook.service;

import com.nevis.notebook.config.GenerationProperties;
import com.nevis.notebook.config.RagProperties;
import com.nevis.notebook.event.JobEnqueuedEvent;
import com.nevis.notebook.exception.NoRelevantContextException;
import com.nevis.notebook.exception.ValidationException;
import com.nevis.notebook.infra.TaskQueue;
import com.nevis.notebook.model.AnswerPath;
import com.nevis.notebook.model.AssembledContext;
import com.nevis.notebook.model.AuthorizedScope;
import com.nevis.notebook.model.ChatAnswer;
import com.nevis.notebook.model.ChatAnswerTask;
import com.nevis.notebook.model.ChatTurn;
import com.nevis.notebook.model.ContentType;
import com.nevis.notebook.model.ProcessingJob;
import com.nevis.notebook.model.QuestionRequest;
import com.nevis.notebook.model.RetrievedChunk;
import com.nevis.notebook.model.SourceReference;
import com.nevis.notebook.model.TurnRole;
import com.nevis.notebook.repository.ChatSessionRepository;
import com.nevis.notebook.repository.ChatTurnRepository;
import com.nevis.notebook.repository.ProcessingJobRepository;
import dev.langchain4j.data.message.ChatMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class RagOrchestratorImpl implements RagOrchestrator {

    private final ChatSessionService chatSessionService;
    private final ConversationHistoryService historyService;
    private final ChatTurnRepository turnRepository;
    private final ChatSessionRepository sessionRepository;
    private final ScopeProvider scopeProvider;
    private final RetrievalService retrievalService;
    private final ContextAssembler contextAssembler;
    private final PromptFactory promptFactory;
    private final GenerationClient generationClient;
    private final ProcessingJobRepository jobRepository;
    private final TaskQueue taskQueue;
    private final JobPayloadCodec payloadCodec;
    private final ApplicationEventPublisher eventPublisher;
    private final RagProperties ragProperties;
    private final GenerationProperties generationProperties;

    private record PreparedTurn(AnswerPath path, List<ChatMessage> messages, List<SourceReference> sources) {}

    @Override
    public ChatAnswer ask(UUID ownerId, UUID sessionId, QuestionRequest request) {
        String question = validateQuestion(request);
        chatSessionService.requireOwned(ownerId, sessionId);

        List<ChatTurn> history = historyService.history(sessionId);
        ChatTurn userTurn = turnRepository.append(sessionId, TurnRole.USER, question, List.of());
        log.debug("Session {}: user turn {} recorded", sessionId, userTurn.id());

        PreparedTurn prepared = prepare(ownerId, request, history, question);
        String answer = generate(prepared);

        ChatTurn assistantTurn = recordAnswer(sessionId, prepared, answer);
        return new ChatAnswer(userTurn, assistantTurn, prepared.path(), prepared.sources());
    }

    @Override
    public StreamSubscription askStreaming(
        UUID ownerId,
        UUID sessionId,
        QuestionRequest request,
        AnswerStreamListener listener
    ) {
        String question = validateQuestion(request);
        chatSessionService.requireOwned(ownerId, sessionId);

        List<ChatTurn> history = historyService.history(sessionId);
        ChatTurn userTurn = turnRepository.append(sessionId, TurnRole.USER, question, List.of());

        PreparedTurn prepared = prepare(ownerId, request, history, question);

        return generationClient.chatStream(
            prepared.messages(),
            generationProperties.temperature(),
            generationProperties.maxTokens(),
            new TokenStreamListener() {
                @Override
                public void onToken(String token) {
                    listener.onToken(token);
                }

                @Override
                public void onComplete(String fullText) {
                    ChatTurn assistantTurn;
                    try {
                        assistantTurn = recordAnswer(sessionId, prepared, fullText);
                    } catch (RuntimeException e) {
                        log.error("Session {}: failed to record streamed answer", sessionId, e);
                        listener.onError(e);
                        return;
                    }
                    listener.onComplete(new ChatAnswer(userTurn, assistantTurn, prepared.path(), prepared.sources()));
                }

                @Override
                public void onError(Throwable error) {
                    log.warn("Session {}: streamed answer failed: {}", sessionId, error.getMessage());
                    listener.onError(error);
                }
            });
    }

    @Override
    @Transactional
    public ProcessingJob askAsync(UUID ownerId, UUID sessionId, QuestionRequest request) {
        String question = validateQuestion(request);
        chatSessionService.requireOwned(ownerId, sessionId);

        ChatTurn userTurn = turnRepository.append(sessionId, TurnRole.USER, question, List.of());

        ChatAnswerTask task = new ChatAnswerTask(
            ownerId,
            sessionId,
            userTurn.id(),
            userTurn.seq(),
            question,
            request.useRag(),
            request.documentIds() == null ? List.of() : List.copyOf(request.documentIds())
        );

        ProcessingJob job = jobRepository.create(ContentType.CHAT_ANSWER, userTurn.id(), payloadCodec.write(task));
        taskQueue.enqueue(job.id());
        eventPublisher.publishEvent(new JobEnqueuedEvent(job.id(), ContentType.CHAT_ANSWER));

        log.info("Session {}: answer for turn {} queued as job {}", sessionId, userTurn.id(), job.id());
        return job;
    }

    @Override
    public ChatTurn answerRecordedTurn(ChatAnswerTask task) {
        List<ChatTurn> history = historyService.historyBefore(task.sessionId(), task.userTurnSeq());
        QuestionRequest request = new QuestionRequest(task.question(), task.useRag(), task.documentIds());

        PreparedTurn prepared = prepare(task.ownerId(), request, history, task.question());
        String answer = generate(prepared);

        return recordAnswer(task.sessionId(), prepared, answer);
    }

    private PreparedTurn prepare(UUID ownerId, QuestionRequest request, List<ChatTurn> history, String question) {
        if (!request.useRag()) {
            log.info("Turn path: {}", AnswerPath.FREE_GENERATION);
            return new PreparedTurn(AnswerPath.FREE_GENERATION, promptFactory.freeGeneration(history, question), List.of());
        }

        try {
            AssembledContext context = retrieveContext(ownerId, request.documentIds(), question);
            log.info("Turn path: {} with {} sources", AnswerPath.GROUNDED, context.references().size());
            return new PreparedTurn(
                AnswerPath.GROUNDED,
                promptFactory.groundedGeneration(history, context, question),
                context.references());
        } catch (NoRelevantContextException e) {
            log.info("Turn path: {} ({})", AnswerPath.NO_CONTEXT, e.getMessage());
            return new PreparedTurn(AnswerPath.NO_CONTEXT, promptFactory.noContextGeneration(history, question), List.of());
        }
    }

    private AssembledContext retrieveContext(UUID ownerId, List<UUID> documentIds, String question) {
        AuthorizedScope scope = scopeProvider.resolve(ownerId);
        List<RetrievedChunk> chunks = retrievalService.retrieve(question, scope, documentIds, ragProperties.topK());
        AssembledContext context = contextAssembler.assemble(chunks);
        if (context.isEmpty()) {
            throw new NoRelevantContextException(
                "No chunk reached similarity " + ragProperties.similarityThreshold());
        }
        return context;
    }

    private String generate(PreparedTurn prepared) {
        return generationClient.chat(
            prepared.messages(),
            generationProperties.temperature(),
            generationProperties.maxTokens());
    }

    private ChatTurn recordAnswer(UUID sessionId, PreparedTurn prepared, String answer) {
        ChatTurn assistantTurn = turnRepository.append(sessionId, TurnRole.ASSISTANT, answer, prepared.sources());
        sessionRepository.touch(sessionId);
        log.info("Session {}: assistant turn {} recorded ({})", sessionId, assistantTurn.id(), prepared.path());
        return assistantTurn;
    }

    private String validateQuestion(QuestionRequest request) {
        if (request == null || request.question() == null || request.question().isBlank()) {
            throw new ValidationException("Question must not be empty");
        }
        String question = request.question().strip();
        if (question.length() > ragProperties.maxQuestionLength()) {
            throw new ValidationException(
                "Question is longer than " + ragProperties.maxQuestionLength() + " characters");
        }
        return question;
    }
}
