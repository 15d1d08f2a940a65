package com.boardrag.pipeline.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final UUID entityId;

    public EntityNotFoundException(UUID entityId) {
        this("Entity", entityId);
    }

    protected EntityNotFoundException(String entityName, UUID entityId) {
        super(entityName + " not found: " + entityId);
        this.entityId = entityId;
    }
}
