package com.nevis.notebook.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.notebook.model.QuestionRequest;
import jakarta.validation.constraints.NotBlank;

import java.util.List;
import java.util.UUID;

public record MessageRequest(
    @NotBlank
    String question,

    @JsonProperty("use_rag")
    Boolean useRag,

    @JsonProperty("document_ids")
    List<UUID> documentIds
) {
    QuestionRequest toQuestion() {
        return new QuestionRequest(question, useRag == null || useRag, documentIds);
    }
}
