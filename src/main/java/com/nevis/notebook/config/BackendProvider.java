package com.nevis.notebook.config;

public enum BackendProvider {
    GEMINI(EmbeddingDialect.BATCH),
    OLLAMA(EmbeddingDialect.PER_ITEM),
    OPENAI(EmbeddingDialect.BATCH);

    private final EmbeddingDialect defaultEmbeddingDialect;

    BackendProvider(EmbeddingDialect defaultEmbeddingDialect) {
        this.defaultEmbeddingDialect = defaultEmbeddingDialect;
    }

    public EmbeddingDialect defaultEmbeddingDialect() {
        return defaultEmbeddingDialect;
    }
}
