package com.nevis.notebook.config;

/**
 * How an embedding backend accepts input: one text per call, or a native batch.
 */
public enum EmbeddingDialect {
    PER_ITEM,
    BATCH
}
