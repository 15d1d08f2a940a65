package com.boardrag.pipeline.service;

import com.boardrag.pipeline.model.DeferredTask;
import com.boardrag.pipeline.model.TaskType;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record ActiveTaskView(
    UUID taskId,
    TaskType type,
    Map<String, Object> payload,
    String worker,
    int attempts,
    OffsetDateTime startedAt
) {

    public static ActiveTaskView of(DeferredTask task) {
        return new ActiveTaskView(task.id(), task.type(), task.payload(), task.worker(), task.attempts(), task.startedAt());
    }
}
