package com.nevis.notebook.service;

import com.nevis.notebook.event.JobEnqueuedEvent;
import com.nevis.notebook.exception.AuthorizationException;
import com.nevis.notebook.exception.EntityNotFoundException;
import com.nevis.notebook.exception.InvalidStatusTransitionException;
import com.nevis.notebook.exception.ProcessingFailedException;
import com.nevis.notebook.exception.ValidationException;
import com.nevis.notebook.infra.TaskQueue;
import com.nevis.notebook.model.ContentType;
import com.nevis.notebook.model.DocumentChunk;
import com.nevis.notebook.model.DocumentSubmission;
import com.nevis.notebook.model.JobStatus;
import com.nevis.notebook.model.PageText;
import com.nevis.notebook.model.ProcessingJob;
import com.nevis.notebook.model.SourceDocument;
import com.nevis.notebook.repository.DocumentChunkRepository;
import com.nevis.notebook.repository.DocumentRepository;
import com.nevis.notebook.repository.ProcessingJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    private final DocumentRepository documentRepository;
    private final DocumentChunkRepository chunkRepository;
    private final ProcessingJobRepository jobRepository;
    private final TaskQueue taskQueue;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public DocumentSubmission submit(UUID ownerId, String title, List<PageText> pages) {
        validatePages(title, pages);
        log.debug("Submitting document for owner {}: {} ({} pages)", ownerId, title, pages.size());

        SourceDocument document = documentRepository.save(ownerId, title.strip());
        documentRepository.savePages(document.id(), pages);

        ProcessingJob job = jobRepository.create(ContentType.DOCUMENT, document.id(), null);
        taskQueue.enqueue(job.id());
        eventPublisher.publishEvent(new JobEnqueuedEvent(job.id(), ContentType.DOCUMENT));

        log.info("Doc {}: queued as job {}", document.id(), job.id());
        return new DocumentSubmission(document, job);
    }

    @Override
    @Transactional(readOnly = true)
    public SourceDocument getById(UUID ownerId, UUID documentId) {
        return requireOwned(ownerId, documentId);
    }

    @Override
    @Transactional(readOnly = true)
    public ProcessingJob getJob(UUID ownerId, UUID documentId) {
        requireOwned(ownerId, documentId);
        return findJob(documentId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DocumentChunk> getChunks(UUID ownerId, UUID documentId) {
        requireOwned(ownerId, documentId);
        return chunkRepository.findByDocumentId(documentId);
    }

    @Override
    @Transactional
    public ProcessingJob retry(UUID ownerId, UUID documentId) {
        return resubmit(ownerId, documentId, JobStatus.FAILED);
    }

    @Override
    @Transactional
    public ProcessingJob reprocess(UUID ownerId, UUID documentId) {
        return resubmit(ownerId, documentId, JobStatus.COMPLETED);
    }

    private ProcessingJob resubmit(UUID ownerId, UUID documentId, JobStatus expected) {
        requireOwned(ownerId, documentId);
        ProcessingJob job = findJob(documentId);

        if (job.status() != expected) {
            throw new InvalidStatusTransitionException(job.status(), JobStatus.PENDING);
        }
        if (!documentRepository.hasPages(documentId)) {
            throw new ProcessingFailedException(
                "Raw input of document " + documentId + " is no longer retained, upload it again");
        }
        if (!jobRepository.transition(job.id(), expected, JobStatus.PENDING, null)) {
            throw new InvalidStatusTransitionException(expected, JobStatus.PENDING);
        }

        taskQueue.enqueue(job.id());
        eventPublisher.publishEvent(new JobEnqueuedEvent(job.id(), ContentType.DOCUMENT));
        log.info("Doc {}: job {} resubmitted from {}", documentId, job.id(), expected);

        return findJob(documentId);
    }

    private ProcessingJob findJob(UUID documentId) {
        return jobRepository.findByItem(ContentType.DOCUMENT, documentId)
            .orElseThrow(() -> new EntityNotFoundException("Processing job of document", documentId));
    }

    private SourceDocument requireOwned(UUID ownerId, UUID documentId) {
        SourceDocument document = documentRepository.findById(documentId)
            .orElseThrow(() -> {
                log.warn("Document not found with ID: {}", documentId);
                return new EntityNotFoundException("Document", documentId);
            });

        if (!document.ownerId().equals(ownerId)) {
            log.warn("SECURITY: owner {} tried to access document {} of owner {}",
                ownerId, documentId, document.ownerId());
            throw new AuthorizationException("Document is not accessible", ownerId, Set.of(documentId));
        }
        return document;
    }

    private static void validatePages(String title, List<PageText> pages) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("Title must not be empty");
        }
        if (pages == null || pages.isEmpty()) {
            throw new ValidationException("At least one page is required");
        }

        Set<Integer> pageNumbers = new HashSet<>();
        for (PageText page : pages) {
            if (page == null || page.text() == null) {
                throw new ValidationException("Page text must not be null");
            }
            if (page.pageNumber() < 1) {
                throw new ValidationException("Page numbers start at 1, got " + page.pageNumber());
            }
            if (!pageNumbers.add(page.pageNumber())) {
                throw new ValidationException("Duplicate page number " + page.pageNumber());
            }
        }
    }
}
