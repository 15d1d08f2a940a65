package com.boardrag.pipeline.exception;

import lombok.Getter;

@Getter
public class IntegrityMismatchException extends StorageException {
    private final long expectedSize;
    private final long actualSize;

    public IntegrityMismatchException(String key, long expectedSize, long actualSize) {
        super(key, "Stored size of " + key + " is " + actualSize + ", expected " + expectedSize);
        this.expectedSize = expectedSize;
        this.actualSize = actualSize;
    }
}
