package com.nevis.notebook.service;

import com.nevis.notebook.model.AuthorizedScope;
import com.nevis.notebook.model.RetrievedChunk;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface RetrievalService {

    /**
     * Ranks the chunks closest to {@code query}, closest first, restricted to the
     * requested documents (or the whole scope when none are requested). Chunks
     * below the similarity floor are dropped, so the result may be empty.
     *
     * @throws com.nevis.notebook.exception.AuthorizationException when the scope is
     *         unverified or a requested id is outside it
     */
    List<RetrievedChunk> retrieve(String query, AuthorizedScope scope, Collection<UUID> requestedIds, int k);
}
