package com.boardrag.pipeline.model;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record DeferredTask(
    UUID id,
    TaskType type,
    TaskStatus status,
    Map<String, Object> payload,
    Map<String, Object> result,
    String error,
    int attempts,
    int maxAttempts,
    String worker,
    OffsetDateTime nextAttemptAt,
    OffsetDateTime createdAt,
    OffsetDateTime startedAt,
    OffsetDateTime finishedAt
) {

    public boolean hasAttemptsLeft() {
        return attempts < maxAttempts;
    }
}
