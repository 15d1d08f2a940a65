package com.boardrag.pipeline.service;

import com.boardrag.pipeline.model.Document;

import java.util.List;
import java.util.UUID;

/**
 * {@code mainTaskId} is the first upload task of the batch, null for synchronous uploads.
 */
public record DocumentCreateResult(
    Document document,
    List<FileAcceptResult> files,
    UUID mainTaskId
) {}
