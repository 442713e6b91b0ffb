package com.nevis.notebook.service;

import com.nevis.notebook.model.AuthorizedScope;
import com.nevis.notebook.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;

/**
 * Grants an owner every document it owns.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OwnerScopeProvider implements ScopeProvider {

    private final DocumentRepository documentRepository;

    @Override
    public AuthorizedScope resolve(UUID ownerId) {
        Set<UUID> documentIds = documentRepository.findIdsByOwner(ownerId);
        log.debug("Owner {} may query {} documents", ownerId, documentIds.size());
        return AuthorizedScope.verified(ownerId, documentIds);
    }
}
