package com.boardrag.pipeline.controller;

import com.boardrag.pipeline.model.TaskType;
import com.boardrag.pipeline.service.ActiveTaskView;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record ActiveTaskResponse(
    @JsonProperty("task_id")
    UUID taskId,

    TaskType type,

    Map<String, Object> payload,

    String worker,

    int attempts,

    @JsonProperty("started_at")
    OffsetDateTime startedAt
) {

    public static ActiveTaskResponse from(ActiveTaskView view) {
        return new ActiveTaskResponse(view.taskId(), view.type(), view.payload(), view.worker(), view.attempts(), view.startedAt());
    }
}
