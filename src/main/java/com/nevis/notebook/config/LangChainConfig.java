package com.nevis.notebook.config;

import com.nevis.notebook.infra.RateLimiter;
import com.nevis.notebook.service.BatchEmbeddingGateway;
import com.nevis.notebook.service.EmbeddingGateway;
import com.nevis.notebook.service.PerItemEmbeddingGateway;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiStreamingChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.ollama.OllamaStreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Builds one model client per backend, selected once from configuration.
 */
@Slf4j
@Configuration
public class LangChainConfig {

    @Bean
    public ChatModel chatModel(GenerationProperties props) {
        log.info("Generation backend: {} ({})", props.provider(), props.model());
        switch (props.provider()) {
            case GEMINI:
                return GoogleAiGeminiChatModel.builder()
                    .apiKey(props.apiKey())
                    .modelName(props.model())
                    .timeout(props.timeout())
                    .maxRetries(props.maxRetries())
                    .build();
            case OPENAI:
                return OpenAiChatModel.builder()
                    .baseUrl(props.baseUrl())
                    .apiKey(props.apiKey())
                    .modelName(props.model())
                    .timeout(props.timeout())
                    .maxRetries(props.maxRetries())
                    .build();
            case OLLAMA:
            default:
                return OllamaChatModel.builder()
                    .baseUrl(props.baseUrl())
                    .modelName(props.model())
                    .timeout(props.timeout())
                    .maxRetries(props.maxRetries())
                    .build();
        }
    }

    @Bean
    public StreamingChatModel streamingChatModel(GenerationProperties props) {
        switch (props.provider()) {
            case GEMINI:
                return GoogleAiGeminiStreamingChatModel.builder()
                    .apiKey(props.apiKey())
                    .modelName(props.model())
                    .timeout(props.timeout())
                    .build();
            case OPENAI:
                return OpenAiStreamingChatModel.builder()
                    .baseUrl(props.baseUrl())
                    .apiKey(props.apiKey())
                    .modelName(props.model())
                    .timeout(props.timeout())
                    .build();
            case OLLAMA:
            default:
                return OllamaStreamingChatModel.builder()
                    .baseUrl(props.baseUrl())
                    .modelName(props.model())
                    .timeout(props.timeout())
                    .build();
        }
    }

    @Bean
    public EmbeddingModel embeddingModel(EmbeddingProperties props) {
        log.info("Embedding backend: {} ({}, {} dims, dialect {})",
            props.provider(), props.model(), props.dimension(), props.effectiveDialect());
        switch (props.provider()) {
            case GEMINI:
                return GoogleAiEmbeddingModel.builder()
                    .apiKey(props.apiKey())
                    .modelName(props.model())
                    .outputDimensionality(props.dimension())
                    .timeout(props.timeout())
                    .maxRetries(props.maxRetries())
                    .build();
            case OPENAI:
                return OpenAiEmbeddingModel.builder()
                    .baseUrl(props.baseUrl())
                    .apiKey(props.apiKey())
                    .modelName(props.model())
                    .dimensions(props.dimension())
                    .timeout(props.timeout())
                    .maxRetries(props.maxRetries())
                    .build();
            case OLLAMA:
            default:
                return OllamaEmbeddingModel.builder()
                    .baseUrl(props.baseUrl())
                    .modelName(props.model())
                    .timeout(props.timeout())
                    .maxRetries(props.maxRetries())
                    .build();
        }
    }

    @Bean
    public EmbeddingGateway embeddingGateway(
        EmbeddingModel embeddingModel,
        EmbeddingProperties props,
        @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter,
        @Qualifier("embeddingTaskExecutor") Executor embeddingTaskExecutor
    ) {
        if (props.effectiveDialect() == EmbeddingDialect.PER_ITEM) {
            return new PerItemEmbeddingGateway(embeddingModel, props, embeddingLimiter, embeddingTaskExecutor);
        }
        return new BatchEmbeddingGateway(embeddingModel, props, embeddingLimiter);
    }
}
