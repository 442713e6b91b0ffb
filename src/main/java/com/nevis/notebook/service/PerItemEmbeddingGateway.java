package com.nevis.notebook.service;

import com.nevis.notebook.config.EmbeddingProperties;
import com.nevis.notebook.exception.EmbeddingException;
import com.nevis.notebook.infra.RateLimiter;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/**
 * Gateway for backends that take one text per call. Calls run in parallel with
 * at most {@code maxConcurrency} in flight across all callers; results are
 * collected by input position, not by completion order.
 */
@Slf4j
public class PerItemEmbeddingGateway extends AbstractEmbeddingGateway {

    private final Executor executor;
    private final Semaphore inFlight;

    public PerItemEmbeddingGateway(
        EmbeddingModel embeddingModel,
        EmbeddingProperties properties,
        RateLimiter embeddingLimiter,
        Executor executor
    ) {
        super(embeddingModel, properties, embeddingLimiter);
        this.executor = executor;
        this.inFlight = new Semaphore(properties.maxConcurrency(), true);
    }

    @Override
    protected List<float[]> embedValidated(List<String> texts) {
        List<CompletableFuture<float[]>> futures = new ArrayList<>(texts.size());
        for (String text : texts) {
            futures.add(CompletableFuture.supplyAsync(() -> embedOne(text), executor));
        }

        List<float[]> vectors = new ArrayList<>(texts.size());
        try {
            for (CompletableFuture<float[]> future : futures) {
                vectors.add(future.join());
            }
        } catch (CompletionException e) {
            futures.forEach(future -> future.cancel(false));
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new EmbeddingException("Embedding request failed", e.getCause());
        }
        return vectors;
    }

    private float[] embedOne(String text) {
        try {
            inFlight.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while waiting for an embedding slot", e);
        }

        try {
            Response<Embedding> response = callBackend(List.of(text), () -> embeddingModel.embed(text));
            if (response == null || response.content() == null || response.content().vector() == null
                || response.content().vector().length == 0) {
                throw new EmbeddingException("Embedding backend returned an empty vector");
            }
            return response.content().vector();
        } finally {
            inFlight.release();
        }
    }
}
