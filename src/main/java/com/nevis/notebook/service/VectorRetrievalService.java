package com.nevis.notebook.service;

import com.nevis.notebook.config.RagProperties;
import com.nevis.notebook.exception.AuthorizationException;
import com.nevis.notebook.exception.ValidationException;
import com.nevis.notebook.model.AuthorizedScope;
import com.nevis.notebook.model.RetrievedChunk;
import com.nevis.notebook.repository.DocumentChunkRepository;
import com.nevis.notebook.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class VectorRetrievalService implements RetrievalService {

    private final EmbeddingGateway embeddingGateway;
    private final DocumentChunkRepository chunkRepository;
    private final DocumentRepository documentRepository;
    private final RagProperties ragProperties;

    @Override
    public List<RetrievedChunk> retrieve(String query, AuthorizedScope scope, Collection<UUID> requestedIds, int k) {
        if (scope == null || !scope.verified() || scope.documentIds() == null || scope.ownerId() == null) {
            UUID ownerId = scope == null ? null : scope.ownerId();
            log.warn("SECURITY: retrieval refused, scope of owner {} is not verified", ownerId);
            throw new AuthorizationException("Document scope is not verified", ownerId);
        }
        if (query == null || query.isBlank()) {
            throw new ValidationException("Query must not be empty");
        }

        Set<UUID> searchIds = verifyRequestedIds(scope, requestedIds);
        if (searchIds.isEmpty()) {
            log.debug("Owner {} has no documents to search", scope.ownerId());
            return List.of();
        }

        float[] queryVector = embeddingGateway.embed(List.of(query)).get(0);

        List<RetrievedChunk> candidates = chunkRepository.findNearest(
            queryVector, scope.ownerId(), searchIds, k, ragProperties.distanceMetric());

        double threshold = ragProperties.similarityThreshold();
        List<RetrievedChunk> relevant = candidates.stream()
            .filter(chunk -> chunk.similarity() >= threshold)
            .toList();

        log.debug("Retrieved {} candidates over {} documents, {} at or above similarity {}",
            candidates.size(), searchIds.size(), relevant.size(), threshold);
        return relevant;
    }

    /**
     * Every requested id must be in the allow-list and, independently, owned by
     * the caller in the store. Any miss fails the whole request.
     */
    private Set<UUID> verifyRequestedIds(AuthorizedScope scope, Collection<UUID> requestedIds) {
        if (requestedIds == null || requestedIds.isEmpty()) {
            return scope.documentIds();
        }

        Set<UUID> requested = new LinkedHashSet<>(requestedIds);
        Set<UUID> outside = requested.stream()
            .filter(id -> !scope.documentIds().contains(id))
            .collect(Collectors.toSet());

        if (!outside.isEmpty()) {
            log.warn("SECURITY: owner {} requested documents outside its scope: {}", scope.ownerId(), outside);
            throw new AuthorizationException("Requested documents are not accessible", scope.ownerId(), outside);
        }

        int owned = documentRepository.countOwnedBy(scope.ownerId(), requested);
        if (owned != requested.size()) {
            log.warn("SECURITY: owner {} requested {} documents, only {} are owned: {}",
                scope.ownerId(), requested.size(), owned, requested);
            throw new AuthorizationException("Requested documents are not accessible", scope.ownerId(), requested);
        }

        return requested;
    }
}
