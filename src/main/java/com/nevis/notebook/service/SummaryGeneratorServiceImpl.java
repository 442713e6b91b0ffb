package com.nevis.notebook.service;

import com.nevis.notebook.config.GenerationProperties;
import com.nevis.notebook.config.PipelineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SummaryGeneratorServiceImpl implements SummaryGeneratorService {

    private final GenerationClient generationClient;
    private final PromptFactory promptFactory;
    private final PipelineProperties pipelineProperties;
    private final GenerationProperties generationProperties;

    @Override
    public String summarize(String text) {
        if (text == null || text.isBlank()) {
            log.warn("Empty content, skipping summary");
            return null;
        }

        int maxChars = pipelineProperties.summaryMaxChars();
        String head = text.substring(0, Math.min(text.length(), maxChars));

        String summary = generationClient.chat(
            promptFactory.summary(head),
            pipelineProperties.summaryTemperature(),
            generationProperties.maxTokens());

        log.debug("Summary generated from {} of {} chars", head.length(), text.length());
        return summary.strip();
    }
}
