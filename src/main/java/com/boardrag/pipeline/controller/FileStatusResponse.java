package com.boardrag.pipeline.controller;

import com.boardrag.pipeline.model.DocumentFile;
import com.boardrag.pipeline.model.FileProcessingStatus;
import com.boardrag.pipeline.service.FileStatusView;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record FileStatusResponse(
    @JsonProperty("file_id")
    UUID fileId,

    String filename,

    @JsonProperty("file_type")
    String fileType,

    @JsonProperty("file_size")
    long fileSize,

    FileProcessingStatus status,

    @JsonProperty("error_message")
    String errorMessage,

    @JsonProperty("is_public")
    boolean isPublic,

    @JsonProperty("exists_in_storage")
    boolean existsInStorage,

    Map<String, Object> metadata,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt
) {

    public static FileStatusResponse from(FileStatusView view) {
        return from(view.file(), view.existsInStorage());
    }

    public static FileStatusResponse from(DocumentFile file, boolean existsInStorage) {
        return new FileStatusResponse(
            file.id(),
            file.originalFilename(),
            file.fileType(),
            file.fileSize(),
            file.processingStatus(),
            file.errorMessage(),
            file.isPublic(),
            existsInStorage,
            file.metadata(),
            file.createdAt(),
            file.updatedAt()
        );
    }
}
