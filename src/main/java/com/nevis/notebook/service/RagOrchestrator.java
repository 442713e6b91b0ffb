package com.nevis.notebook.service;

import com.nevis.notebook.model.ChatAnswer;
import com.nevis.notebook.model.ChatAnswerTask;
import com.nevis.notebook.model.ChatTurn;
import com.nevis.notebook.model.ProcessingJob;
import com.nevis.notebook.model.QuestionRequest;

import java.util.UUID;

/**
 * Runs one conversation turn: record the user turn, pick free, grounded or
 * no-context generation, then record the assistant turn. A failure leaves the
 * user turn in place and records no assistant turn.
 */
public interface RagOrchestrator {

    ChatAnswer ask(UUID ownerId, UUID sessionId, QuestionRequest request);

    /**
     * Streaming variant of {@link #ask}. The assistant turn is recorded only after
     * the stream completes; cancelling the subscription drops it.
     */
    StreamSubscription askStreaming(UUID ownerId, UUID sessionId, QuestionRequest request, AnswerStreamListener listener);

    /**
     * Records the user turn and queues the answer as a background job.
     */
    ProcessingJob askAsync(UUID ownerId, UUID sessionId, QuestionRequest request);

    /**
     * Answers a user turn recorded by {@link #askAsync}; used by the job handler.
     */
    ChatTurn answerRecordedTurn(ChatAnswerTask task);
}
