package com.nevis.notebook.service;

import com.nevis.notebook.exception.BackendUnavailableException;
import com.nevis.notebook.exception.BackendUnavailableException.Backend;
import dev.langchain4j.exception.RetriableException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Tells a backend outage (network, timeout, overload) apart from every other
 * failure.
 */
final class BackendFailures {

    private BackendFailures() {
    }

    static boolean isTransient(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof RetriableException
                || current instanceof IOException
                || current instanceof TimeoutException
                || current instanceof BackendUnavailableException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Wraps a transient failure as {@link BackendUnavailableException}; returns
     * {@code null} for anything else so the caller picks its own type.
     */
    static BackendUnavailableException unavailable(Backend backend, Throwable error) {
        if (error instanceof BackendUnavailableException) {
            return (BackendUnavailableException) error;
        }
        if (!isTransient(error)) {
            return null;
        }
        String name = backend == Backend.EMBEDDING ? "Embedding" : "Generation";
        return new BackendUnavailableException(backend, name + " backend unavailable: " + error.getMessage(), error);
    }
}
