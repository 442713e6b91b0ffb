package com.nevis.notebook.model;

/**
 * A chunk produced by the chunker, before it has an embedding or an id.
 */
public record ChunkDraft(int chunkIndex, Integer pageNumber, String content) {}
