package com.nevis.notebook.exception;

/**
 * Retrieval found nothing above the similarity floor. A legitimate terminal
 * state of a grounded turn, answered with an explicit "no answer found".
 */
public class NoRelevantContextException extends RuntimeException {

    public NoRelevantContextException(String message) {
        super(message);
    }
}
