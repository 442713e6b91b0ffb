package com.nevis.notebook.service;

import com.nevis.notebook.config.RagProperties;
import com.nevis.notebook.model.AssembledContext;
import com.nevis.notebook.model.RetrievedChunk;
import com.nevis.notebook.model.SourceReference;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns ranked chunks into prompt text with a "title (page N)" header per
 * chunk, plus the distinct sources in rank order.
 */
@Component
@RequiredArgsConstructor
public class ContextAssembler {

    private final RagProperties ragProperties;

    public AssembledContext assemble(List<RetrievedChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return AssembledContext.empty();
        }

        List<String> entries = new ArrayList<>(chunks.size());
        Set<SourceReference> references = new LinkedHashSet<>();

        for (RetrievedChunk chunk : chunks) {
            if (chunk.content() == null || chunk.content().isBlank()) {
                continue;
            }
            SourceReference reference = chunk.reference();
            entries.add("[" + reference.label() + "]\n" + chunk.content().strip());
            references.add(reference);
        }

        if (entries.isEmpty()) {
            return AssembledContext.empty();
        }
        return new AssembledContext(String.join(ragProperties.contextSeparator(), entries), List.copyOf(references));
    }
}
