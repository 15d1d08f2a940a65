package com.boardrag.pipeline.controller;

import com.boardrag.pipeline.model.DocumentStatus;
import com.boardrag.pipeline.model.FileProcessingStatus;
import com.boardrag.pipeline.service.AdminStats;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record StatsResponse(
    @JsonProperty("documents_by_status")
    Map<DocumentStatus, Long> documentsByStatus,

    @JsonProperty("vectorized_documents")
    long vectorizedDocuments,

    @JsonProperty("files_by_status")
    Map<FileProcessingStatus, Long> filesByStatus,

    @JsonProperty("total_chunks")
    long totalChunks
) {

    public static StatsResponse from(AdminStats stats) {
        return new StatsResponse(stats.documentsByStatus(), stats.vectorizedDocuments(), stats.filesByStatus(), stats.totalChunks());
    }
}
