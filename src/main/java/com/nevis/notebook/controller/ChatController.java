package com.nevis.notebook.controller;

import com.nevis.notebook.config.GenerationProperties;
import com.nevis.notebook.service.ChatSessionService;
import com.nevis.notebook.service.RagOrchestrator;
import com.nevis.notebook.service.StreamSubscription;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/sessions")
@RequiredArgsConstructor
public class ChatController {

    private final ChatSessionService chatSessionService;
    private final RagOrchestrator ragOrchestrator;
    private final GenerationProperties generationProperties;

    @PostMapping
    public ResponseEntity<SessionResponse> createSession(
        @RequestHeader(OwnerHeader.NAME) UUID ownerId,
        @Valid @RequestBody(required = false) SessionRequest request) {
        String title = request == null ? null : request.title();
        SessionResponse response = SessionResponse.from(chatSessionService.create(ownerId, title));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{id}/turns")
    public ResponseEntity<List<TurnResponse>> getTurns(
        @RequestHeader(OwnerHeader.NAME) UUID ownerId,
        @PathVariable UUID id) {
        List<TurnResponse> turns = chatSessionService.turns(ownerId, id).stream()
            .map(TurnResponse::from)
            .toList();
        return ResponseEntity.ok(turns);
    }

    @PostMapping("/{id}/messages")
    public ResponseEntity<AnswerResponse> sendMessage(
        @RequestHeader(OwnerHeader.NAME) UUID ownerId,
        @PathVariable UUID id,
        @Valid @RequestBody MessageRequest request) {
        return ResponseEntity.ok(AnswerResponse.from(ragOrchestrator.ask(ownerId, id, request.toQuestion())));
    }

    @PostMapping(path = "/{id}/messages/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamMessage(
        @RequestHeader(OwnerHeader.NAME) UUID ownerId,
        @PathVariable UUID id,
        @Valid @RequestBody MessageRequest request) {
        SseEmitter emitter = new SseEmitter(generationProperties.timeout().toMillis());
        SseAnswerListener listener = new SseAnswerListener(emitter);

        StreamSubscription subscription = ragOrchestrator.askStreaming(ownerId, id, request.toQuestion(), listener);
        listener.attach(subscription);
        return emitter;
    }

    @PostMapping("/{id}/messages/async")
    public ResponseEntity<JobResponse> sendMessageAsync(
        @RequestHeader(OwnerHeader.NAME) UUID ownerId,
        @PathVariable UUID id,
        @Valid @RequestBody MessageRequest request) {
        JobResponse job = JobResponse.from(ragOrchestrator.askAsync(ownerId, id, request.toQuestion()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @GetMapping("/{id}/jobs/{jobId}")
    public ResponseEntity<JobResponse> getAnswerJob(
        @RequestHeader(OwnerHeader.NAME) UUID ownerId,
        @PathVariable UUID id,
        @PathVariable UUID jobId) {
        return ResponseEntity.ok(JobResponse.from(chatSessionService.answerJob(ownerId, id, jobId)));
    }
}
