package com.nevis.notebook.model;

import java.util.UUID;

public record SourceReference(UUID documentId, String title, Integer pageNumber) {

    public String label() {
        return pageNumber == null ? title : title + " (page " + pageNumber + ")";
    }
}
