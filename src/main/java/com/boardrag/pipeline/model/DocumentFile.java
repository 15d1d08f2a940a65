package com.boardrag.pipeline.model;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record DocumentFile(
    UUID id,
    UUID documentId,
    String storageKey,
    String originalFilename,
    String fileType,
    long fileSize,
    String contentType,
    FileProcessingStatus processingStatus,
    Map<String, Object> metadata,
    String errorMessage,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {

    public boolean isPublic() {
        Object value = metadata == null ? null : metadata.get(FileMetadataKeys.IS_PUBLIC);
        return value == null || Boolean.TRUE.equals(value);
    }
}
