package com.nevis.notebook.service;

import com.nevis.notebook.config.BackendProvider;
import com.nevis.notebook.config.EmbeddingProperties;
import com.nevis.notebook.exception.BackendUnavailableException;
import com.nevis.notebook.exception.EmbeddingException;
import com.nevis.notebook.exception.ValidationException;
import com.nevis.notebook.infra.RateLimiter;
import com.nevis.notebook.model.BackendHealth;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PerItemEmbeddingGatewayTest {

    @Mock
    private EmbeddingModel embeddingModel;

    @Mock
    private RateLimiter embeddingLimiter;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(16);

        lenient().when(embeddingLimiter.call(anyString(), anyInt(), any()))
            .thenAnswer(invocation -> {
                Supplier<?> supplier = invocation.getArgument(2);
                return supplier.get();
            });
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Vectors come back in input order, not completion order")
    void shouldPreserveInputOrder() {
        PerItemEmbeddingGateway gateway = gateway(5);
        List<String> texts = List.of("t0", "t1", "t2", "t3", "t4");

        when(embeddingModel.embed(anyString())).thenAnswer(invocation -> {
            String text = invocation.getArgument(0);
            int index = Integer.parseInt(text.substring(1));
            // earlier texts finish later
            Thread.sleep(50L * (texts.size() - index));
            return Response.from(Embedding.from(new float[]{index, 1f}));
        });

        List<float[]> vectors = gateway.embed(texts);

        assertThat(vectors).hasSize(5);
        for (int i = 0; i < texts.size(); i++) {
            assertThat(vectors.get(i)[0]).isEqualTo((float) i);
        }
    }

    @Test
    @DisplayName("Never more than maxConcurrency calls in flight")
    void shouldRespectConcurrencyCeiling() {
        PerItemEmbeddingGateway gateway = gateway(5);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        when(embeddingModel.embed(anyString())).thenAnswer(invocation -> {
            int current = inFlight.incrementAndGet();
            peak.accumulateAndGet(current, Math::max);
            Thread.sleep(30);
            inFlight.decrementAndGet();
            return Response.from(Embedding.from(new float[]{1f}));
        });

        List<String> texts = IntStream.range(0, 40).mapToObj(i -> "chunk " + i).toList();
        List<float[]> vectors = gateway.embed(texts);

        assertThat(vectors).hasSize(40);
        assertThat(peak.get()).isLessThanOrEqualTo(5);
        verify(embeddingLimiter, times(40)).call(eq("nomic-embed-text"), anyInt(), any());
    }

    @Test
    @DisplayName("Blank text is rejected before any backend call")
    void shouldRejectBlankText() {
        PerItemEmbeddingGateway gateway = gateway(5);

        assertThatThrownBy(() -> gateway.embed(List.of("fine", " ")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("index 1");
        verifyNoInteractions(embeddingModel);
    }

    @Test
    @DisplayName("Null input is rejected, empty input returns no vectors")
    void shouldHandleNullAndEmptyInput() {
        PerItemEmbeddingGateway gateway = gateway(5);

        assertThatThrownBy(() -> gateway.embed(null)).isInstanceOf(ValidationException.class);
        assertThat(gateway.embed(List.of())).isEmpty();
    }

    @Test
    @DisplayName("Network failure surfaces as BackendUnavailableException")
    void shouldMapNetworkFailure() {
        PerItemEmbeddingGateway gateway = gateway(5);
        when(embeddingModel.embed(anyString()))
            .thenThrow(new UncheckedIOException(new IOException("Connection refused")));

        assertThatThrownBy(() -> gateway.embed(List.of("hello")))
            .isInstanceOf(BackendUnavailableException.class)
            .satisfies(e -> assertThat(((BackendUnavailableException) e).getBackend())
                .isEqualTo(BackendUnavailableException.Backend.EMBEDDING));
    }

    @Test
    @DisplayName("Empty vector from the backend is an EmbeddingException")
    void shouldRejectEmptyVector() {
        PerItemEmbeddingGateway gateway = gateway(5);
        when(embeddingModel.embed(anyString())).thenReturn(Response.from(Embedding.from(new float[0])));

        assertThatThrownBy(() -> gateway.embed(List.of("hello")))
            .isInstanceOf(EmbeddingException.class);
    }

    @Test
    @DisplayName("Health check reports the observed dimension against the configured one")
    void shouldReportDimensionMismatch() {
        PerItemEmbeddingGateway gateway = gateway(5);
        when(embeddingModel.embed("test")).thenReturn(Response.from(Embedding.from(new float[384])));

        BackendHealth health = gateway.healthCheck();

        assertThat(health.reachable()).isTrue();
        assertThat(health.dimension()).isEqualTo(384);
        assertThat(health.dimensionMatches()).isFalse();
        assertThat(health.provider()).isEqualTo("OLLAMA");
    }

    @Test
    @DisplayName("Health check reports an unreachable backend instead of throwing")
    void shouldReportUnreachableBackend() {
        PerItemEmbeddingGateway gateway = gateway(5);
        when(embeddingModel.embed("test")).thenThrow(new UncheckedIOException(new IOException("timeout")));

        BackendHealth health = gateway.healthCheck();

        assertThat(health.reachable()).isFalse();
        assertThat(health.error()).contains("timeout");
    }

    private PerItemEmbeddingGateway gateway(int maxConcurrency) {
        EmbeddingProperties properties = new EmbeddingProperties(
            BackendProvider.OLLAMA, null, "http://localhost:11434", null, "nomic-embed-text",
            768, maxConcurrency, 64, Duration.ofSeconds(5), 0);
        return new PerItemEmbeddingGateway(embeddingModel, properties, embeddingLimiter, executor);
    }
}
