package com.nevis.notebook.controller;

import com.nevis.notebook.model.DocumentSubmission;
import com.nevis.notebook.model.PageText;
import com.nevis.notebook.service.DocumentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentService documentService;

    @PostMapping
    public ResponseEntity<DocumentSubmissionResponse> submitDocument(
        @RequestHeader(OwnerHeader.NAME) UUID ownerId,
        @Valid @RequestBody DocumentRequest request) {

        List<PageText> pages = request.pages().stream()
            .map(page -> new PageText(page.pageNumber(), page.text()))
            .toList();

        DocumentSubmission submission = documentService.submit(ownerId, request.title(), pages);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(DocumentSubmissionResponse.from(submission));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DocumentResponse> getDocument(
        @RequestHeader(OwnerHeader.NAME) UUID ownerId,
        @PathVariable UUID id) {
        return ResponseEntity.ok(DocumentResponse.from(documentService.getById(ownerId, id)));
    }

    @GetMapping("/{id}/job")
    public ResponseEntity<JobResponse> getJob(
        @RequestHeader(OwnerHeader.NAME) UUID ownerId,
        @PathVariable UUID id) {
        return ResponseEntity.ok(JobResponse.from(documentService.getJob(ownerId, id)));
    }

    @GetMapping("/{id}/chunks")
    public ResponseEntity<List<ChunkResponse>> getChunks(
        @RequestHeader(OwnerHeader.NAME) UUID ownerId,
        @PathVariable UUID id) {
        List<ChunkResponse> chunks = documentService.getChunks(ownerId, id).stream()
            .map(ChunkResponse::from)
            .toList();
        return ResponseEntity.ok(chunks);
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<JobResponse> retry(
        @RequestHeader(OwnerHeader.NAME) UUID ownerId,
        @PathVariable UUID id) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobResponse.from(documentService.retry(ownerId, id)));
    }

    @PostMapping("/{id}/reprocess")
    public ResponseEntity<JobResponse> reprocess(
        @RequestHeader(OwnerHeader.NAME) UUID ownerId,
        @PathVariable UUID id) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobResponse.from(documentService.reprocess(ownerId, id)));
    }
}
