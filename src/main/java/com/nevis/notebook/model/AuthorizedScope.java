package com.nevis.notebook.model;

import java.util.Set;
import java.util.UUID;

/**
 * Allow-list of document ids a caller may query. Only a {@code verified} scope
 * may be used in a retrieval predicate.
 */
public record AuthorizedScope(UUID ownerId, Set<UUID> documentIds, boolean verified) {

    public static AuthorizedScope verified(UUID ownerId, Set<UUID> documentIds) {
        return new AuthorizedScope(ownerId, Set.copyOf(documentIds), true);
    }
}
