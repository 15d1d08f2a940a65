package com.boardrag.pipeline.controller;

import com.boardrag.pipeline.model.TaskStatus;
import com.boardrag.pipeline.model.TaskType;
import com.boardrag.pipeline.service.TaskView;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.UUID;

public record TaskStatusResponse(
    @JsonProperty("task_id")
    UUID taskId,

    TaskType type,

    TaskStatus status,

    Map<String, Object> result,

    String error
) {

    public static TaskStatusResponse from(TaskView view) {
        return new TaskStatusResponse(view.taskId(), view.type(), view.status(), view.result(), view.error());
    }
}
