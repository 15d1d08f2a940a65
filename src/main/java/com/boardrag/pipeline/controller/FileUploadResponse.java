package com.boardrag.pipeline.controller;

import com.boardrag.pipeline.model.FileProcessingStatus;
import com.boardrag.pipeline.service.FileAcceptResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record FileUploadResponse(
    @JsonProperty("file_id")
    UUID fileId,

    String filename,

    @JsonProperty("storage_key")
    String storageKey,

    @JsonProperty("file_type")
    String fileType,

    @JsonProperty("file_size")
    long fileSize,

    FileProcessingStatus status,

    @JsonProperty("task_id")
    UUID taskId,

    String error
) {

    public static FileUploadResponse from(FileAcceptResult result) {
        return new FileUploadResponse(
            result.fileId(),
            result.originalFilename(),
            result.storageKey(),
            result.fileType(),
            result.fileSize(),
            result.status(),
            result.taskId(),
            result.error()
        );
    }
}
