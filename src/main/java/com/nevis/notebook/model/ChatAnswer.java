package com.nevis.notebook.model;

import java.util.List;

public record ChatAnswer(
    ChatTurn userTurn,
    ChatTurn assistantTurn,
    AnswerPath path,
    List<SourceReference> sources
) {}
