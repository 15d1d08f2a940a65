package com.boardrag.pipeline.controller;

import com.boardrag.pipeline.service.DocumentCreateResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

public record DocumentCreateResponse(
    DocumentResponse document,

    List<FileUploadResponse> files,

    @JsonProperty("main_task_id")
    UUID mainTaskId
) {

    public static DocumentCreateResponse from(DocumentCreateResult result) {
        return new DocumentCreateResponse(
            DocumentResponse.from(result.document()),
            result.files().stream().map(FileUploadResponse::from).toList(),
            result.mainTaskId()
        );
    }
}
