package com.boardrag.pipeline.repository;

import com.boardrag.pipeline.model.DocumentFile;
import com.boardrag.pipeline.model.FileProcessingStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public interface DocumentFileRepository {
    DocumentFile save(DocumentFile file);
    Optional<DocumentFile> findById(UUID id);
    List<DocumentFile> findByDocumentId(UUID documentId);
    List<DocumentFile> findByDocumentIdAndStatus(UUID documentId, FileProcessingStatus status);
    int countByDocumentId(UUID documentId);
    DocumentFile transition(UUID id, FileProcessingStatus target, String errorMessage, Map<String, Object> metadataPatch);
    void mergeMetadata(UUID id, Map<String, Object> metadataPatch);
    void deleteById(UUID id);
    Map<FileProcessingStatus, Long> countByStatus();
}
