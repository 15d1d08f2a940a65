package com.boardrag.pipeline.task;

import com.boardrag.pipeline.model.TaskType;

import java.util.UUID;

public record TaskEnqueuedEvent(UUID taskId, TaskType type) {}
