package com.nevis.notebook.service;

import com.nevis.notebook.model.AuthorizedScope;

import java.util.UUID;

/**
 * Source of the set of documents a caller may query.
 */
public interface ScopeProvider {

    AuthorizedScope resolve(UUID ownerId);
}
