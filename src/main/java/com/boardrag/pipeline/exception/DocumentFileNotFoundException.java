package com.boardrag.pipeline.exception;

import java.util.UUID;

public class DocumentFileNotFoundException extends EntityNotFoundException {

    public DocumentFileNotFoundException(UUID fileId) {
        super("Document file", fileId);
    }
}
