package com.boardrag.pipeline.model;

/**
 * Externally visible task states. The names are polled by string comparison and must not change.
 */
public enum TaskStatus {
    PENDING,
    STARTED,
    SUCCESS,
    FAILURE,
    REVOKED;

    public boolean isFinished() {
        return this == SUCCESS || this == FAILURE || this == REVOKED;
    }

    public boolean isRevocable() {
        return this == PENDING || this == STARTED;
    }
}
