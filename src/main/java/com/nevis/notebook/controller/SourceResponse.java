package com.nevis.notebook.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.notebook.model.SourceReference;

import java.util.UUID;

public record SourceResponse(
    @JsonProperty("document_id")
    UUID documentId,

    String title,

    @JsonProperty("page_number")
    Integer pageNumber
) {
    static SourceResponse from(SourceReference reference) {
        return new SourceResponse(reference.documentId(), reference.title(), reference.pageNumber());
    }
}
