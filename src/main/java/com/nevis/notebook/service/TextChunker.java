package com.nevis.notebook.service;

import com.nevis.notebook.config.ChunkingProperties;
import com.nevis.notebook.model.ChunkDraft;
import com.nevis.notebook.model.PageText;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits page text into bounded, overlapping chunks that prefer natural
 * boundaries. Deterministic for a given input and configuration.
 */
@Getter
@Component
public class TextChunker {

    /**
     * Split candidates in order of preference: paragraph, line, sentence ends
     * (CJK and Latin), then any space.
     */
    static final List<String> SEPARATORS = List.of("\n\n", "\n", "。", ".", "！", "？", "!", "?", " ");

    private final int chunkSize;
    private final int overlap;

    public TextChunker(ChunkingProperties properties) {
        if (properties.size() == null || properties.size() < 1) {
            throw new IllegalArgumentException("Chunk size must be positive");
        }
        if (properties.overlap() == null || properties.overlap() < 0) {
            throw new IllegalArgumentException("Chunk overlap must not be negative");
        }
        if (properties.overlap() >= properties.size()) {
            throw new IllegalArgumentException(
                "Chunk overlap (" + properties.overlap() + ") must be smaller than chunk size (" + properties.size() + ")");
        }
        this.chunkSize = properties.size();
        this.overlap = properties.overlap();
    }

    /**
     * Chunks every page on its own; {@code chunkIndex} runs across pages without gaps.
     */
    public List<ChunkDraft> chunkPages(List<PageText> pages) {
        List<ChunkDraft> drafts = new ArrayList<>();
        if (pages == null) {
            return drafts;
        }

        int chunkIndex = 0;
        for (PageText page : pages) {
            for (String content : chunk(page.text())) {
                drafts.add(new ChunkDraft(chunkIndex++, page.pageNumber(), content));
            }
        }
        return drafts;
    }

    public List<String> chunk(String rawText) {
        List<String> chunks = new ArrayList<>();
        if (rawText == null || rawText.isBlank()) {
            return chunks;
        }

        String text = rawText.strip();
        if (text.length() <= chunkSize) {
            chunks.add(text);
            return chunks;
        }

        int start = 0;
        while (start < text.length()) {
            int end = start + chunkSize;
            if (end >= text.length()) {
                addIfNotBlank(chunks, text.substring(start));
                break;
            }

            int split = findSplitPoint(text, start, end);
            addIfNotBlank(chunks, text.substring(start, split));

            int next = split - overlap;
            start = next > start ? next : split;
        }
        return chunks;
    }

    /**
     * Last occurrence of the best separator inside {@code [start, end)}, accepted
     * only past the middle of the window. Falls back to a hard cut at {@code end}.
     */
    private int findSplitPoint(String text, int start, int end) {
        int minimum = start + chunkSize / 2;
        for (String separator : SEPARATORS) {
            int pos = text.lastIndexOf(separator, end - separator.length());
            if (pos > minimum) {
                return pos + separator.length();
            }
        }
        return end;
    }

    private static void addIfNotBlank(List<String> chunks, String candidate) {
        String trimmed = candidate.strip();
        if (!trimmed.isEmpty()) {
            chunks.add(trimmed);
        }
    }
}
