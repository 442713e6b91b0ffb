package com.nevis.notebook.exception;

import lombok.Getter;

import java.util.Set;
import java.util.UUID;

/**
 * The caller asked for something outside its authorized scope. Always a hard
 * failure, never downgraded to a filtered result.
 */
@Getter
public class AuthorizationException extends RuntimeException {
    private final UUID ownerId;
    private final Set<UUID> offendingIds;

    public AuthorizationException(String message, UUID ownerId, Set<UUID> offendingIds) {
        super(message);
        this.ownerId = ownerId;
        this.offendingIds = offendingIds == null ? Set.of() : Set.copyOf(offendingIds);
    }

    public AuthorizationException(String message, UUID ownerId) {
        this(message, ownerId, Set.of());
    }
}
