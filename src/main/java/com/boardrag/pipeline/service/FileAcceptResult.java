package com.boardrag.pipeline.service;

import com.boardrag.pipeline.model.FileProcessingStatus;

import java.util.UUID;

/**
 * Outcome of accepting one file. {@code fileId} is null when no document row could be resolved in
 * synchronous mode; {@code taskId} is set only for deferred uploads.
 */
public record FileAcceptResult(
    UUID fileId,
    String originalFilename,
    String storageKey,
    String fileType,
    long fileSize,
    FileProcessingStatus status,
    UUID taskId,
    String error
) {}
