package com.boardrag.pipeline.service;

import com.boardrag.pipeline.model.DeferredTask;
import com.boardrag.pipeline.model.TaskStatus;
import com.boardrag.pipeline.model.TaskType;

import java.util.Map;
import java.util.UUID;

/**
 * Polling view of a task. {@code result} is only exposed on success and {@code error} only on failure.
 */
public record TaskView(
    UUID taskId,
    TaskType type,
    TaskStatus status,
    Map<String, Object> result,
    String error
) {

    public static TaskView of(DeferredTask task) {
        return new TaskView(
            task.id(),
            task.type(),
            task.status(),
            task.status() == TaskStatus.SUCCESS ? task.result() : null,
            task.status() == TaskStatus.FAILURE ? task.error() : null
        );
    }
}
