package com.nevis.notebook.model;

import java.util.List;

public record AssembledContext(String text, List<SourceReference> references) {

    public static AssembledContext empty() {
        return new AssembledContext("", List.of());
    }

    public boolean isEmpty() {
        return text == null || text.isBlank();
    }
}
