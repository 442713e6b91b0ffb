package com.nevis.notebook.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.notebook.model.DocumentChunk;

import java.util.UUID;

public record ChunkResponse(
    UUID id,

    @JsonProperty("chunk_index")
    int chunkIndex,

    @JsonProperty("page_number")
    Integer pageNumber,

    String content,

    boolean embedded
) {
    static ChunkResponse from(DocumentChunk chunk) {
        return new ChunkResponse(chunk.id(), chunk.chunkIndex(), chunk.pageNumber(), chunk.content(), chunk.embedded());
    }
}
