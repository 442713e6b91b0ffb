package com.nevis.notebook.service;

import com.nevis.notebook.config.BackendProvider;
import com.nevis.notebook.config.GenerationProperties;
import com.nevis.notebook.config.PipelineProperties;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SummaryGeneratorServiceTest {

    @Mock
    private GenerationClient generationClient;

    private SummaryGeneratorServiceImpl summaryGeneratorService;

    @BeforeEach
    void setUp() {
        PipelineProperties pipelineProperties = new PipelineProperties(
            true, 2, 1000L, Duration.ofMinutes(10), 200000, 10, 0.2, true,
            new PipelineProperties.Retry(3, Duration.ofMillis(10), 2.0, Duration.ofMillis(100)),
            Map.of());
        GenerationProperties generationProperties = new GenerationProperties(
            BackendProvider.OLLAMA, "http://localhost:11434", null, "gemma3:12b",
            Duration.ofSeconds(30), 0, 0.1, 512);
        summaryGeneratorService = new SummaryGeneratorServiceImpl(
            generationClient, new PromptFactory(), pipelineProperties, generationProperties);
    }

    @Test
    @DisplayName("Should skip the LLM for empty content")
    void shouldHandleEmptyContent() {
        assertThat(summaryGeneratorService.summarize("  ")).isNull();
        verifyNoInteractions(generationClient);
    }

    @Test
    @DisplayName("Should summarize with the summary temperature")
    void shouldGenerateSummary() {
        when(generationClient.chat(anyList(), eq(0.2), eq(512))).thenReturn("  This is a summary.\n");

        assertThat(summaryGeneratorService.summarize("Short report")).isEqualTo("This is a summary.");
    }

    @Test
    @DisplayName("Should truncate content to summaryMaxChars before calling the LLM")
    @SuppressWarnings("unchecked")
    void shouldTruncateContent() {
        when(generationClient.chat(anyList(), anyDouble(), anyInt())).thenReturn("Sum");

        summaryGeneratorService.summarize("Content that is too long");

        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(generationClient).chat(captor.capture(), anyDouble(), anyInt());
        String prompt = ((UserMessage) captor.getValue().get(0)).singleText();
        assertThat(prompt).contains("Content th").doesNotContain("Content that");
    }
}
