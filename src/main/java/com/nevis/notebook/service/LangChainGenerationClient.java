package com.nevis.notebook.service;

import com.nevis.notebook.config.GenerationProperties;
import com.nevis.notebook.exception.BackendUnavailableException;
import com.nevis.notebook.exception.BackendUnavailableException.Backend;
import com.nevis.notebook.exception.GenerationException;
import com.nevis.notebook.infra.RateLimiter;
import com.nevis.notebook.model.BackendHealth;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class LangChainGenerationClient implements GenerationClient {

    private final ChatModel chatModel;
    private final StreamingChatModel streamingChatModel;
    private final RateLimiter generationLimiter;
    private final GenerationProperties properties;

    public LangChainGenerationClient(
        ChatModel chatModel,
        StreamingChatModel streamingChatModel,
        @Qualifier("generationLimiter") RateLimiter generationLimiter,
        GenerationProperties properties
    ) {
        this.chatModel = chatModel;
        this.streamingChatModel = streamingChatModel;
        this.generationLimiter = generationLimiter;
        this.properties = properties;
    }

    @Override
    public String chat(List<ChatMessage> messages, double temperature, int maxTokens) {
        ChatRequest request = buildRequest(messages, temperature, maxTokens);

        ChatResponse response;
        try {
            response = generationLimiter.call(properties.model(), estimateTokens(messages),
                () -> chatModel.chat(request));
        } catch (RuntimeException e) {
            throw translate(e);
        }

        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new GenerationException("Generation backend returned an empty answer");
        }
        return text;
    }

    @Override
    public StreamSubscription chatStream(
        List<ChatMessage> messages,
        double temperature,
        int maxTokens,
        TokenStreamListener listener
    ) {
        ChatRequest request = buildRequest(messages, temperature, maxTokens);
        StreamSubscription subscription = new StreamSubscription();
        StringBuilder received = new StringBuilder();

        try {
            generationLimiter.admit(properties.model(), estimateTokens(messages));
            streamingChatModel.chat(request, new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String token) {
                    if (subscription.isCancelled() || token == null) {
                        return;
                    }
                    received.append(token);
                    listener.onToken(token);
                }

                @Override
                public void onCompleteResponse(ChatResponse response) {
                    if (subscription.isCancelled()) {
                        log.debug("Stream finished after cancellation, answer dropped");
                        return;
                    }
                    String text = response != null && response.aiMessage() != null && response.aiMessage().text() != null
                        ? response.aiMessage().text()
                        : received.toString();
                    if (text.isBlank()) {
                        listener.onError(new GenerationException("Generation backend returned an empty answer"));
                        return;
                    }
                    listener.onComplete(text);
                }

                @Override
                public void onError(Throwable error) {
                    if (subscription.isCancelled()) {
                        log.debug("Stream failed after cancellation: {}", error.getMessage());
                        return;
                    }
                    listener.onError(translate(error));
                }
            });
        } catch (RuntimeException e) {
            throw translate(e);
        }

        return subscription;
    }

    @Override
    public BackendHealth healthCheck() {
        try {
            chat(List.of(UserMessage.from("ping")), 0.0, 8);
            return new BackendHealth("generation", properties.provider().name(), properties.model(),
                true, null, null, null);
        } catch (RuntimeException e) {
            log.warn("Generation health check failed: {}", e.getMessage());
            return new BackendHealth("generation", properties.provider().name(), properties.model(),
                false, null, null, e.getMessage());
        }
    }

    private ChatRequest buildRequest(List<ChatMessage> messages, double temperature, int maxTokens) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("At least one message is required");
        }
        return ChatRequest.builder()
            .messages(messages)
            .temperature(temperature)
            .maxOutputTokens(maxTokens)
            .build();
    }

    private RuntimeException translate(Throwable error) {
        if (error instanceof GenerationException) {
            return (GenerationException) error;
        }
        BackendUnavailableException unavailable = BackendFailures.unavailable(Backend.GENERATION, error);
        if (unavailable != null) {
            log.warn("Generation backend unavailable: {}", error.getMessage());
            return unavailable;
        }
        return new GenerationException("Generation failed: " + error.getMessage(), error);
    }

    private static int estimateTokens(List<ChatMessage> messages) {
        int chars = 0;
        for (ChatMessage message : messages) {
            if (message instanceof SystemMessage) {
                chars += ((SystemMessage) message).text().length();
            } else if (message instanceof UserMessage && ((UserMessage) message).hasSingleText()) {
                chars += ((UserMessage) message).singleText().length();
            } else if (message instanceof AiMessage && ((AiMessage) message).text() != null) {
                chars += ((AiMessage) message).text().length();
            }
        }
        return Math.max(1, chars / 4);
    }
}
