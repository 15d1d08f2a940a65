package com.boardrag.pipeline.repository;

import com.boardrag.pipeline.model.DeferredTask;
import com.boardrag.pipeline.model.TaskStatus;
import com.boardrag.pipeline.model.TaskType;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public interface TaskRepository {
    DeferredTask create(TaskType type, Map<String, Object> payload, int maxAttempts);
    Optional<DeferredTask> findById(UUID id);
    Optional<DeferredTask> claimNext(String worker);
    boolean markSucceeded(UUID id, Map<String, Object> result);
    boolean markFailed(UUID id, String error);
    boolean reschedule(UUID id, String error, Duration delay);
    Optional<DeferredTask> revoke(UUID id);
    List<DeferredTask> findByStatus(TaskStatus status);
    int refreshStarted(Collection<UUID> ids);
    List<UUID> requeueStale(Duration staleAfter);
    List<UUID> failExhaustedStale(Duration staleAfter);
}
