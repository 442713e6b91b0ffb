package com.nevis.notebook.worker;

import com.nevis.notebook.config.PipelineProperties;
import com.nevis.notebook.exception.ProcessingFailedException;
import com.nevis.notebook.model.ChunkDraft;
import com.nevis.notebook.model.ContentType;
import com.nevis.notebook.model.PageText;
import com.nevis.notebook.model.ProcessingJob;
import com.nevis.notebook.repository.DocumentChunkRepository;
import com.nevis.notebook.repository.DocumentRepository;
import com.nevis.notebook.service.EmbeddingGateway;
import com.nevis.notebook.service.SummaryGeneratorService;
import com.nevis.notebook.service.TextChunker;
import com.nevis.notebook.service.TextFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Rebuilds a document's chunks and embeddings from its pages, then stores the
 * formatted text and its summary.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentProcessingHandler implements JobHandler {

    private final DocumentRepository documentRepository;
    private final DocumentChunkRepository chunkRepository;
    private final TextChunker chunker;
    private final TextFormatter textFormatter;
    private final EmbeddingGateway embeddingGateway;
    private final SummaryGeneratorService summaryGeneratorService;
    private final PipelineProperties pipelineProperties;

    @Override
    public ContentType contentType() {
        return ContentType.DOCUMENT;
    }

    @Override
    public void handle(ProcessingJob job) {
        UUID documentId = job.itemId();

        documentRepository.findById(documentId)
            .orElseThrow(() -> new ProcessingFailedException("Document " + documentId + " no longer exists"));

        List<PageText> pages = documentRepository.findPages(documentId);
        if (pages.isEmpty()) {
            throw new ProcessingFailedException("Raw input of document " + documentId + " is not available");
        }

        List<ChunkDraft> drafts = chunker.chunkPages(pages);
        log.info("Doc {}: {} pages split into {} chunks", documentId, pages.size(), drafts.size());

        List<float[]> embeddings = embeddingGateway.embed(drafts.stream().map(ChunkDraft::content).toList());
        chunkRepository.replaceChunks(documentId, drafts, embeddings);

        String fullText = pages.stream().map(PageText::text).collect(Collectors.joining("\n\n"));
        String formatted = textFormatter.format(fullText, pipelineProperties.formatMaxChars());
        String summary = summaryGeneratorService.summarize(formatted);
        documentRepository.updateDerivedText(documentId, formatted, summary);

        if (!pipelineProperties.retainRawInput()) {
            documentRepository.deletePages(documentId);
            log.debug("Doc {}: raw pages purged", documentId);
        }
    }

    @Override
    public boolean hasRetainedInput(ProcessingJob job) {
        return documentRepository.hasPages(job.itemId());
    }
}
