package com.boardrag.pipeline.task;

import com.boardrag.pipeline.model.DeferredTask;
import com.boardrag.pipeline.model.TaskType;

import java.util.Map;

/**
 * Executes one task type. The returned map becomes the task result; failures are reported by
 * throwing, preferably a {@link com.boardrag.pipeline.exception.TaskExecutionException}.
 */
public interface TaskHandler {

    TaskType type();

    Map<String, Object> handle(DeferredTask task);
}
