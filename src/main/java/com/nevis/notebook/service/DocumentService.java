package com.nevis.notebook.service;

import com.nevis.notebook.model.DocumentChunk;
import com.nevis.notebook.model.DocumentSubmission;
import com.nevis.notebook.model.PageText;
import com.nevis.notebook.model.ProcessingJob;
import com.nevis.notebook.model.SourceDocument;

import java.util.List;
import java.util.UUID;

public interface DocumentService {

    /**
     * Stores the document with its page text and queues it for processing.
     */
    DocumentSubmission submit(UUID ownerId, String title, List<PageText> pages);

    SourceDocument getById(UUID ownerId, UUID documentId);

    ProcessingJob getJob(UUID ownerId, UUID documentId);

    List<DocumentChunk> getChunks(UUID ownerId, UUID documentId);

    /**
     * Resubmits a failed document from its retained page text.
     */
    ProcessingJob retry(UUID ownerId, UUID documentId);

    /**
     * Resubmits a completed document, e.g. after a chunking or model change.
     */
    ProcessingJob reprocess(UUID ownerId, UUID documentId);
}
