package com.nevis.notebook.service;

import com.nevis.notebook.config.BackendProvider;
import com.nevis.notebook.config.GenerationProperties;
import com.nevis.notebook.exception.BackendUnavailableException;
import com.nevis.notebook.exception.GenerationException;
import com.nevis.notebook.infra.RateLimiter;
import com.nevis.notebook.model.BackendHealth;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LangChainGenerationClientTest {

    @Mock
    private ChatModel chatModel;

    @Mock
    private StreamingChatModel streamingChatModel;

    @Mock
    private RateLimiter generationLimiter;

    private LangChainGenerationClient client;

    private final List<ChatMessage> messages = List.of(UserMessage.from("What is in the report?"));

    @BeforeEach
    void setUp() {
        GenerationProperties properties = new GenerationProperties(
            BackendProvider.OLLAMA, "http://localhost:11434", null, "gemma3:12b",
            Duration.ofSeconds(30), 0, 0.1, 512);
        client = new LangChainGenerationClient(chatModel, streamingChatModel, generationLimiter, properties);

        lenient().when(generationLimiter.call(anyString(), anyInt(), any()))
            .thenAnswer(invocation -> {
                Supplier<?> supplier = invocation.getArgument(2);
                return supplier.get();
            });
    }

    @Nested
    @DisplayName("Blocking chat")
    class BlockingChat {

        @Test
        @DisplayName("Should return the answer text and pass sampling parameters")
        void shouldReturnAnswer() {
            when(chatModel.chat(any(ChatRequest.class))).thenReturn(response("The report covers Q3."));

            String answer = client.chat(messages, 0.3, 256);

            assertThat(answer).isEqualTo("The report covers Q3.");
            ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
            verify(chatModel).chat(captor.capture());
            assertThat(captor.getValue().temperature()).isEqualTo(0.3);
            assertThat(captor.getValue().maxOutputTokens()).isEqualTo(256);
            verify(generationLimiter).call(eq("gemma3:12b"), anyInt(), any());
        }

        @Test
        @DisplayName("An empty answer is a GenerationException, never an empty string")
        void shouldRejectEmptyAnswer() {
            when(chatModel.chat(any(ChatRequest.class))).thenReturn(response("  "));

            assertThatThrownBy(() -> client.chat(messages, 0.1, 256))
                .isInstanceOf(GenerationException.class);
        }

        @Test
        @DisplayName("Retriable errors surface as BackendUnavailableException")
        void shouldMapRetriableError() {
            when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RetriableException("timeout"));

            assertThatThrownBy(() -> client.chat(messages, 0.1, 256))
                .isInstanceOf(BackendUnavailableException.class)
                .satisfies(e -> assertThat(((BackendUnavailableException) e).getBackend())
                    .isEqualTo(BackendUnavailableException.Backend.GENERATION));
        }

        @Test
        @DisplayName("Other errors surface as GenerationException")
        void shouldMapOtherError() {
            when(chatModel.chat(any(ChatRequest.class))).thenThrow(new IllegalStateException("model not found"));

            assertThatThrownBy(() -> client.chat(messages, 0.1, 256))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("model not found");
        }
    }

    @Nested
    @DisplayName("Streaming chat")
    class StreamingChat {

        @Test
        @DisplayName("Should relay tokens and complete with the full text")
        void shouldRelayTokens() {
            RecordingListener listener = new RecordingListener();

            client.chatStream(messages, 0.1, 256, listener);
            StreamingChatResponseHandler handler = captureHandler();
            handler.onPartialResponse("The ");
            handler.onPartialResponse("answer");
            handler.onCompleteResponse(response("The answer"));

            assertThat(listener.tokens).containsExactly("The ", "answer");
            assertThat(listener.completed).isEqualTo("The answer");
            assertThat(listener.error).isNull();
        }

        @Test
        @DisplayName("Nothing is delivered after the subscription is cancelled")
        void shouldStopAfterCancel() {
            RecordingListener listener = new RecordingListener();

            StreamSubscription subscription = client.chatStream(messages, 0.1, 256, listener);
            StreamingChatResponseHandler handler = captureHandler();
            handler.onPartialResponse("The ");
            subscription.cancel();
            handler.onPartialResponse("answer");
            handler.onCompleteResponse(response("The answer"));

            assertThat(listener.tokens).containsExactly("The ");
            assertThat(listener.completed).isNull();
        }

        @Test
        @DisplayName("A stream that produces no text ends in an error")
        void shouldFailOnEmptyStream() {
            RecordingListener listener = new RecordingListener();

            client.chatStream(messages, 0.1, 256, listener);
            captureHandler().onCompleteResponse(ChatResponse.builder().aiMessage(AiMessage.from("")).build());

            assertThat(listener.completed).isNull();
            assertThat(listener.error).isInstanceOf(GenerationException.class);
        }

        @Test
        @DisplayName("Backend errors during the stream reach the listener translated")
        void shouldTranslateStreamError() {
            RecordingListener listener = new RecordingListener();

            client.chatStream(messages, 0.1, 256, listener);
            captureHandler().onError(new RetriableException("connection reset"));

            assertThat(listener.error).isInstanceOf(BackendUnavailableException.class);
        }
    }

    @Test
    @DisplayName("Health check reports provider and model")
    void shouldReportHealth() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(response("pong"));

        BackendHealth health = client.healthCheck();

        assertThat(health.reachable()).isTrue();
        assertThat(health.provider()).isEqualTo("OLLAMA");
        assertThat(health.model()).isEqualTo("gemma3:12b");
    }

    private StreamingChatResponseHandler captureHandler() {
        ArgumentCaptor<StreamingChatResponseHandler> captor = ArgumentCaptor.forClass(StreamingChatResponseHandler.class);
        verify(streamingChatModel).chat(any(ChatRequest.class), captor.capture());
        return captor.getValue();
    }

    private static ChatResponse response(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }

    private static class RecordingListener implements TokenStreamListener {
        private final List<String> tokens = new ArrayList<>();
        private String completed;
        private Throwable error;

        @Override
        public void onToken(String token) {
            tokens.add(token);
        }

        @Override
        public void onComplete(String fullText) {
            completed = fullText;
        }

        @Override
        public void onError(Throwable error) {
            this.error = error;
        }
    }
}
