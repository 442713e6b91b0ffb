package com.nevis.notebook.model;

public enum AnswerPath {
    FREE_GENERATION,
    NO_CONTEXT,
    GROUNDED
}
