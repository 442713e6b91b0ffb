package com.nevis.notebook.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle to a running stream; cancelling stops delivery to the consumer.
 */
public final class StreamSubscription {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
