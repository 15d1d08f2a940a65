package com.boardrag.pipeline.task;

import com.boardrag.pipeline.model.TaskType;

import java.util.Map;
import java.util.UUID;

/**
 * Submits deferred work. The returned id is the only handle callers keep.
 */
public interface TaskEnqueuer {
    UUID enqueue(TaskType type, Map<String, Object> payload);
}
