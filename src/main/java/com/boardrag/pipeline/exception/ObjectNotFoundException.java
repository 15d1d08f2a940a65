package com.boardrag.pipeline.exception;

public class ObjectNotFoundException extends StorageException {

    public ObjectNotFoundException(String key) {
        super(key, "Object not found in storage: " + key);
    }

    public ObjectNotFoundException(String key, String message) {
        super(key, message);
    }
}
