package com.nevis.notebook.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final UUID entityId;

    public EntityNotFoundException(String entityName, UUID entityId) {
        super(entityName + " not found: " + entityId);
        this.entityId = entityId;
    }
}
