package com.nevis.notebook.repository;

import com.nevis.notebook.config.RagProperties.DistanceMetric;
import com.nevis.notebook.model.ChunkDraft;
import com.nevis.notebook.model.DocumentChunk;
import com.nevis.notebook.model.RetrievedChunk;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface DocumentChunkRepository {

    /**
     * Deletes every chunk of the document and inserts {@code drafts} with their
     * embeddings, in one transaction. Concurrent calls for the same document
     * serialize on the document row.
     */
    void replaceChunks(UUID documentId, List<ChunkDraft> drafts, List<float[]> embeddings);

    List<DocumentChunk> findByDocumentId(UUID documentId);

    /**
     * Nearest embedded chunks among {@code documentIds} owned by {@code ownerId},
     * closest first, with {@code similarity = 1 - distance}.
     */
    List<RetrievedChunk> findNearest(
        float[] queryVector,
        UUID ownerId,
        Collection<UUID> documentIds,
        int limit,
        DistanceMetric metric
    );
}
