package com.boardrag.pipeline.exception;

import lombok.Getter;

@Getter
public class FileValidationException extends RuntimeException {
    private final String filename;

    public FileValidationException(String filename, String message) {
        super(message);
        this.filename = filename;
    }
}
