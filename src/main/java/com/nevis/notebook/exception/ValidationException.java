package com.nevis.notebook.exception;

/**
 * Bad caller input. Never retried.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
