package com.boardrag.pipeline.service;

import com.boardrag.pipeline.model.DocumentStatus;
import com.boardrag.pipeline.model.FileProcessingStatus;

import java.util.Map;

public record AdminStats(
    Map<DocumentStatus, Long> documentsByStatus,
    long vectorizedDocuments,
    Map<FileProcessingStatus, Long> filesByStatus,
    long totalChunks
) {}
