package com.nevis.notebook.service;

import com.nevis.notebook.model.BackendHealth;

import java.util.List;

/**
 * Uniform entry point to an embedding backend, whatever call shape it has.
 */
public interface EmbeddingGateway {

    /**
     * Embeds every text. The i-th vector always belongs to the i-th text.
     *
     * @throws com.nevis.notebook.exception.ValidationException for null or blank input
     * @throws com.nevis.notebook.exception.BackendUnavailableException on network or timeout failures
     * @throws com.nevis.notebook.exception.EmbeddingException when the backend answers with something unusable
     */
    List<float[]> embed(List<String> texts);

    /**
     * Embeds a trivial sample and reports reachability and the observed dimension.
     */
    BackendHealth healthCheck();
}
