package com.nevis.notebook.model;

import java.util.List;
import java.util.UUID;

public record QuestionRequest(String question, boolean useRag, List<UUID> documentIds) {}
