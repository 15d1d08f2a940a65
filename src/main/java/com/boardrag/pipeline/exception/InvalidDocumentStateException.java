package com.boardrag.pipeline.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class InvalidDocumentStateException extends RuntimeException {
    private final UUID documentId;

    public InvalidDocumentStateException(UUID documentId, String message) {
        super(message);
        this.documentId = documentId;
    }
}
