package com.boardrag.pipeline.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class DocumentValidityException extends RuntimeException {
    private final UUID documentId;

    public DocumentValidityException(UUID documentId, String message) {
        super(message);
        this.documentId = documentId;
    }
}
