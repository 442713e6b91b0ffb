package com.nevis.notebook.model;

public enum ContentType {
    DOCUMENT,
    CHAT_ANSWER
}
