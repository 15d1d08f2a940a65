package com.boardrag.pipeline.repository;

import com.boardrag.pipeline.model.Document;
import com.boardrag.pipeline.model.DocumentStatus;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public interface DocumentRepository {
    Document save(Document document);
    Optional<Document> findById(UUID id);
    List<Document> findAllById(Collection<UUID> ids);
    void updateStatus(UUID id, DocumentStatus status, Map<String, Object> metadataPatch);
    void updateVectorized(UUID id, boolean vectorized, Map<String, Object> metadataPatch);
    void mergeMetadata(UUID id, Map<String, Object> metadataPatch);
    void incrementDownloadCount(UUID id);
    List<Document> findVectorizedOutsideValidity(OffsetDateTime now);
    Map<DocumentStatus, Long> countByStatus();
    long countVectorized();
}
