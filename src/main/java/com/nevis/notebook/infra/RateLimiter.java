package com.nevis.notebook.infra;

import java.util.function.Supplier;

/**
 * Admission control in front of an embedding or generation backend. Quota is
 * kept per model, so two models behind the same backend do not share it.
 */
public interface RateLimiter {

    /**
     * Blocks until {@code model} may take one more call costing roughly
     * {@code estimatedTokens}.
     */
    void admit(String model, int estimatedTokens);

    default <T> T call(String model, int estimatedTokens, Supplier<T> backendCall) {
        admit(model, estimatedTokens);
        return backendCall.get();
    }
}
