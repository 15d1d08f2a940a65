package com.boardrag.pipeline.repository;

import com.boardrag.pipeline.model.DocumentChunk;

import java.util.List;
import java.util.UUID;

public interface DocumentChunkRepository {
    void saveAll(List<DocumentChunk> chunks);
    List<DocumentChunk> findByDocumentId(UUID documentId);
    List<String> findVectorIdsByDocumentId(UUID documentId);
    List<String> findVectorIdsByFileId(UUID fileId);
    List<String> findSummaryVectorIds(UUID documentId);
    int deleteByDocumentId(UUID documentId);
    int deleteByFileId(UUID fileId);
    int deleteSummaryChunks(UUID documentId);
    long countAll();
}
