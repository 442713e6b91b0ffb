package com.nevis.notebook.controller;

import com.nevis.notebook.exception.BackendUnavailableException;
import com.nevis.notebook.model.ChatAnswer;
import com.nevis.notebook.service.AnswerStreamListener;
import com.nevis.notebook.service.StreamSubscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Relays an answer stream to an SSE client: {@code token} events, then one
 * {@code done} event with the persisted turns, or one {@code error} event.
 * A failed write means the client is gone and cancels the upstream stream.
 */
@Slf4j
class SseAnswerListener implements AnswerStreamListener {

    static final String TOKEN_EVENT = "token";
    static final String DONE_EVENT = "done";
    static final String ERROR_EVENT = "error";

    private final SseEmitter emitter;
    private final AtomicReference<StreamSubscription> subscription = new AtomicReference<>();

    SseAnswerListener(SseEmitter emitter) {
        this.emitter = emitter;
    }

    void attach(StreamSubscription streamSubscription) {
        subscription.set(streamSubscription);
        emitter.onCompletion(streamSubscription::cancel);
        emitter.onTimeout(streamSubscription::cancel);
        emitter.onError(error -> streamSubscription.cancel());
    }

    @Override
    public void onToken(String token) {
        send(SseEmitter.event().name(TOKEN_EVENT).data(token));
    }

    @Override
    public void onComplete(ChatAnswer answer) {
        if (send(SseEmitter.event().name(DONE_EVENT).data(AnswerResponse.from(answer)))) {
            emitter.complete();
        }
    }

    @Override
    public void onError(Throwable error) {
        HttpStatus status = error instanceof BackendUnavailableException
            ? HttpStatus.SERVICE_UNAVAILABLE
            : HttpStatus.INTERNAL_SERVER_ERROR;
        ErrorResponse body = new ErrorResponse(
            error.getMessage(),
            status == HttpStatus.SERVICE_UNAVAILABLE ? "BACKEND_UNAVAILABLE" : "BACKEND_FAILED",
            status.value(),
            Instant.now().toEpochMilli());
        if (send(SseEmitter.event().name(ERROR_EVENT).data(body))) {
            emitter.complete();
        }
    }

    private boolean send(SseEmitter.SseEventBuilder event) {
        try {
            emitter.send(event);
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE client disconnected: {}", e.getMessage());
            StreamSubscription current = subscription.get();
            if (current != null) {
                current.cancel();
            }
            emitter.completeWithError(e);
            return false;
        }
    }
}
