package com.boardrag.pipeline.exception;

import lombok.Getter;

/**
 * Raised by a task handler. Retryable failures go back to the queue while attempts remain.
 */
@Getter
public class TaskExecutionException extends RuntimeException {
    private final boolean retryable;

    private TaskExecutionException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static TaskExecutionException retryable(String message, Throwable cause) {
        return new TaskExecutionException(message, cause, true);
    }

    public static TaskExecutionException retryable(String message) {
        return new TaskExecutionException(message, null, true);
    }

    public static TaskExecutionException fatal(String message, Throwable cause) {
        return new TaskExecutionException(message, cause, false);
    }

    public static TaskExecutionException fatal(String message) {
        return new TaskExecutionException(message, null, false);
    }
}
