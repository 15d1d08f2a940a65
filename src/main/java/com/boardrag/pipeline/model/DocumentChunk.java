package com.boardrag.pipeline.model;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * A fragment of extracted text. {@code fileId} is null for chunks cut from the document summary.
 */
public record DocumentChunk(
    UUID id,
    UUID documentId,
    UUID fileId,
    int chunkIndex,
    String content,
    String vectorId,
    String embeddingModel,
    String embeddingVersion,
    Map<String, Object> metadata,
    OffsetDateTime createdAt
) {}
