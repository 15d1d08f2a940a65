package com.boardrag.pipeline.exception;

import lombok.Getter;

@Getter
public class StorageException extends RuntimeException {
    private final String key;

    public StorageException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public StorageException(String key, String message) {
        super(message);
        this.key = key;
    }
}
