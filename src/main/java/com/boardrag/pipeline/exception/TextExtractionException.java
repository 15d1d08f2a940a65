package com.boardrag.pipeline.exception;

public class TextExtractionException extends RuntimeException {

    public TextExtractionException(String storageKey, Throwable cause) {
        super("Failed to extract text from " + storageKey + ": " + cause.getMessage(), cause);
    }
}
