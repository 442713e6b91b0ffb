package com.nevis.notebook.repository;

import com.nevis.notebook.model.PageText;
import com.nevis.notebook.model.SourceDocument;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public interface DocumentRepository {

    SourceDocument save(UUID ownerId, String title);

    Optional<SourceDocument> findById(UUID id);

    void savePages(UUID documentId, List<PageText> pages);

    List<PageText> findPages(UUID documentId);

    boolean hasPages(UUID documentId);

    void deletePages(UUID documentId);

    Set<UUID> findIdsByOwner(UUID ownerId);

    /**
     * Counts how many of {@code documentIds} exist and belong to {@code ownerId}.
     */
    int countOwnedBy(UUID ownerId, Collection<UUID> documentIds);

    void updateDerivedText(UUID id, String formattedText, String summary);
}
