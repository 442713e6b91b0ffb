package com.nevis.notebook.exception;

/**
 * Non-transient embedding failure, e.g. a response that does not line up with
 * the request.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
