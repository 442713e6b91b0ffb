package com.nevis.notebook.service;

import com.nevis.notebook.config.EmbeddingProperties;
import com.nevis.notebook.exception.EmbeddingException;
import com.nevis.notebook.infra.RateLimiter;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Gateway for backends with a native multi-text call, sent in slices of
 * {@code batchSize}.
 */
@Slf4j
public class BatchEmbeddingGateway extends AbstractEmbeddingGateway {

    public BatchEmbeddingGateway(
        EmbeddingModel embeddingModel,
        EmbeddingProperties properties,
        RateLimiter embeddingLimiter
    ) {
        super(embeddingModel, properties, embeddingLimiter);
    }

    @Override
    protected List<float[]> embedValidated(List<String> texts) {
        int batchSize = properties.batchSize();
        List<float[]> vectors = new ArrayList<>(texts.size());

        for (int from = 0; from < texts.size(); from += batchSize) {
            List<String> batch = texts.subList(from, Math.min(from + batchSize, texts.size()));
            List<TextSegment> segments = batch.stream().map(TextSegment::from).toList();

            Response<List<Embedding>> response = callBackend(batch, () -> embeddingModel.embedAll(segments));

            List<Embedding> embeddings = response == null ? null : response.content();
            if (embeddings == null || embeddings.size() != batch.size()) {
                throw new EmbeddingException("Embedding backend returned "
                    + (embeddings == null ? 0 : embeddings.size()) + " vectors for " + batch.size() + " texts");
            }
            embeddings.forEach(embedding -> vectors.add(embedding.vector()));
        }

        log.debug("Embedded {} texts in {} batches", texts.size(), (texts.size() + batchSize - 1) / batchSize);
        return vectors;
    }
}
