package com.boardrag.pipeline.exception;

import java.util.UUID;

public class TaskNotFoundException extends EntityNotFoundException {

    public TaskNotFoundException(UUID taskId) {
        super("Task", taskId);
    }
}
