package com.nevis.notebook.model;

import java.util.UUID;

public record RetrievedChunk(
    UUID chunkId,
    UUID documentId,
    String documentTitle,
    int chunkIndex,
    Integer pageNumber,
    String content,
    double similarity
) {

    public SourceReference reference() {
        return new SourceReference(documentId, documentTitle, pageNumber);
    }
}
