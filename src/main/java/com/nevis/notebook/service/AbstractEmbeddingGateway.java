package com.nevis.notebook.service;

import com.nevis.notebook.config.EmbeddingProperties;
import com.nevis.notebook.exception.BackendUnavailableException;
import com.nevis.notebook.exception.BackendUnavailableException.Backend;
import com.nevis.notebook.exception.EmbeddingException;
import com.nevis.notebook.exception.ValidationException;
import com.nevis.notebook.infra.RateLimiter;
import com.nevis.notebook.model.BackendHealth;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

@Slf4j
public abstract class AbstractEmbeddingGateway implements EmbeddingGateway {

    private static final String HEALTH_PROBE = "test";

    protected final EmbeddingModel embeddingModel;
    protected final EmbeddingProperties properties;
    private final RateLimiter embeddingLimiter;

    protected AbstractEmbeddingGateway(
        EmbeddingModel embeddingModel,
        EmbeddingProperties properties,
        RateLimiter embeddingLimiter
    ) {
        this.embeddingModel = embeddingModel;
        this.properties = properties;
        this.embeddingLimiter = embeddingLimiter;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null) {
            throw new ValidationException("Texts to embed must not be null");
        }
        if (texts.isEmpty()) {
            return Collections.emptyList();
        }
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            if (text == null || text.isBlank()) {
                throw new ValidationException("Text to embed at index " + i + " is empty");
            }
        }

        log.debug("Embedding {} texts via {}", texts.size(), getClass().getSimpleName());
        return embedValidated(texts);
    }

    protected abstract List<float[]> embedValidated(List<String> texts);

    /**
     * Runs one backend call under the rate limiter and maps its failures onto the
     * gateway's exception types.
     */
    protected <T> T callBackend(List<String> texts, Supplier<T> call) {
        int estimatedTokens = texts.stream().mapToInt(String::length).sum() / 4;
        try {
            return embeddingLimiter.call(properties.model(), estimatedTokens, call);
        } catch (EmbeddingException | ValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            BackendUnavailableException unavailable = BackendFailures.unavailable(Backend.EMBEDDING, e);
            if (unavailable != null) {
                log.warn("Embedding backend unavailable: {}", e.getMessage());
                throw unavailable;
            }
            throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
        }
    }

    @Override
    public BackendHealth healthCheck() {
        try {
            float[] vector = embed(List.of(HEALTH_PROBE)).get(0);
            boolean matches = vector.length == properties.dimension();
            if (!matches) {
                log.warn("Embedding model {} returns {} dims, configured dimension is {}",
                    properties.model(), vector.length, properties.dimension());
            }
            return new BackendHealth("embedding", properties.provider().name(), properties.model(),
                true, vector.length, matches, null);
        } catch (RuntimeException e) {
            log.warn("Embedding health check failed: {}", e.getMessage());
            return new BackendHealth("embedding", properties.provider().name(), properties.model(),
                false, null, null, e.getMessage());
        }
    }
}
