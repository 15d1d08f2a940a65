package com.boardrag.pipeline.exception;

import java.util.UUID;

public class DocumentNotFoundException extends EntityNotFoundException {

    public DocumentNotFoundException(UUID documentId) {
        super("Document", documentId);
    }
}
