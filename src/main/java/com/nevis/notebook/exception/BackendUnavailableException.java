package com.nevis.notebook.exception;

import lombok.Getter;

/**
 * Network or timeout failure talking to an embedding or generation backend.
 * The async pipeline retries it; the interactive path surfaces it immediately.
 */
@Getter
public class BackendUnavailableException extends RuntimeException {

    public enum Backend {
        EMBEDDING,
        GENERATION
    }

    private final Backend backend;

    public BackendUnavailableException(Backend backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }
}
