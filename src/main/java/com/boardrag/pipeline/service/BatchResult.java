package com.boardrag.pipeline.service;

import java.util.List;
import java.util.UUID;

/**
 * Per-member outcome of a batch review. Members fail independently.
 */
public record BatchResult(
    List<UUID> succeeded,
    List<BatchFailure> failed
) {

    public record BatchFailure(UUID documentId, String reason) {}
}
