package com.boardrag.pipeline.task;

import com.boardrag.pipeline.config.TaskProperties;
import com.boardrag.pipeline.model.DeferredTask;
import com.boardrag.pipeline.model.TaskType;
import com.boardrag.pipeline.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Writes the task row in the caller's transaction, so a rolled back request never leaves work
 * behind. Workers are woken once the transaction commits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcTaskEnqueuer implements TaskEnqueuer {

    private final TaskRepository taskRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final TaskProperties properties;

    @Override
    public UUID enqueue(TaskType type, Map<String, Object> payload) {
        DeferredTask task = taskRepository.create(type, payload, properties.maxAttempts());
        log.debug("Task {}: queued {}", task.id(), type);
        eventPublisher.publishEvent(new TaskEnqueuedEvent(task.id(), type));
        return task.id();
    }
}
