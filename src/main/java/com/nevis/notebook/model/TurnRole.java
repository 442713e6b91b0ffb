package com.nevis.notebook.model;

public enum TurnRole {
    USER,
    ASSISTANT
}
