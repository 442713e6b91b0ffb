package com.nevis.notebook.exception;

public class ProcessingFailedException extends RuntimeException {

    public ProcessingFailedException(String message) {
        super(message);
    }

    public ProcessingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
