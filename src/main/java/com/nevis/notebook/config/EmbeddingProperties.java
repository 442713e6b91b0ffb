package com.nevis.notebook.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * The embedding backend. {@code dimension} is a global constant and must match
 * the {@code vector(N)} column of {@code document_chunks}.
 */
@Validated
@ConfigurationProperties(prefix = "app.embedding")
public record EmbeddingProperties(
    @NotNull BackendProvider provider,
    EmbeddingDialect dialect,
    String baseUrl,
    String apiKey,
    @NotBlank String model,
    @NotNull @Min(1) Integer dimension,
    @NotNull @Min(1) Integer maxConcurrency,
    @NotNull @Min(1) Integer batchSize,
    @NotNull Duration timeout,
    @NotNull @Min(0) Integer maxRetries
) {

    public EmbeddingDialect effectiveDialect() {
        return dialect != null ? dialect : provider.defaultEmbeddingDialect();
    }
}
