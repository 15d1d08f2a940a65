package com.boardrag.pipeline.service;

import com.boardrag.pipeline.chunking.SentenceAwareChunker;
import com.boardrag.pipeline.config.ChunkingProperties;
import com.boardrag.pipeline.exception.DocumentNotFoundException;
import com.boardrag.pipeline.infra.VectorIndex;
import com.boardrag.pipeline.model.Document;
import com.boardrag.pipeline.model.DocumentChunk;
import com.boardrag.pipeline.model.DocumentFile;
import com.boardrag.pipeline.model.DocumentMetadataKeys;
import com.boardrag.pipeline.repository.DocumentChunkRepository;
import com.boardrag.pipeline.repository.DocumentFileRepository;
import com.boardrag.pipeline.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Owns chunk rows and the {@code vectorized} flag of their document. Chunk rows and remote vectors
 * are always removed together; a failing vector delete is recorded on the document and never blocks
 * the local cleanup.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChunkLifecycleService {

    static final String SYSTEM_ACTOR = "system";
    static final String VALIDITY_REASON = "Document expired or not yet valid";

    private final DocumentRepository documentRepository;
    private final DocumentFileRepository fileRepository;
    private final DocumentChunkRepository chunkRepository;
    private final VectorIndex vectorIndex;
    private final SentenceAwareChunker summaryChunker;
    private final ChunkingProperties properties;

    /**
     * Replaces the chunks of {@code file}. Running it twice with the same input leaves the same rows.
     */
    @Transactional
    public List<DocumentChunk> createChunksForFile(Document document, DocumentFile file, List<String> chunkTexts) {
        removeVectors(document.id(), chunkRepository.findVectorIdsByFileId(file.id()));
        chunkRepository.deleteByFileId(file.id());

        List<DocumentChunk> chunks = buildChunks(document, file, chunkTexts);
        chunkRepository.saveAll(chunks);
        log.info("Doc {}: stored {} chunks for file {}", document.id(), chunks.size(), file.id());
        return chunks;
    }

    @Transactional
    public List<DocumentChunk> createChunksForSummary(Document document) {
        removeVectors(document.id(), chunkRepository.findSummaryVectorIds(document.id()));
        chunkRepository.deleteSummaryChunks(document.id());

        if (!document.hasSummary()) {
            return List.of();
        }

        List<DocumentChunk> chunks = buildChunks(document, null, summaryChunker.chunk(document.summary()));
        chunkRepository.saveAll(chunks);
        log.info("Doc {}: stored {} summary chunks", document.id(), chunks.size());
        return chunks;
    }

    @Transactional
    public int deleteChunksForDocument(UUID documentId) {
        removeVectors(documentId, chunkRepository.findVectorIdsByDocumentId(documentId));
        int deleted = chunkRepository.deleteByDocumentId(documentId);
        log.info("Doc {}: deleted {} chunks", documentId, deleted);
        return deleted;
    }

    @Transactional
    public int deleteChunksForFile(UUID fileId) {
        List<String> vectorIds = chunkRepository.findVectorIdsByFileId(fileId);
        UUID documentId = fileRepository.findById(fileId).map(DocumentFile::documentId).orElse(null);
        removeVectors(documentId, vectorIds);
        int deleted = chunkRepository.deleteByFileId(fileId);
        log.debug("File {}: deleted {} chunks", fileId, deleted);
        return deleted;
    }

    @Transactional
    public void markVectorized(UUID documentId, int chunkCount, Map<String, Object> extraMetadata) {
        Map<String, Object> metadata = new LinkedHashMap<>(extraMetadata);
        metadata.put(DocumentMetadataKeys.VECTORIZE_COMPLETED_AT, Instant.now().toString());
        metadata.put(DocumentMetadataKeys.VECTORIZE_CHUNK_COUNT, chunkCount);
        documentRepository.updateVectorized(documentId, true, metadata);
    }

    /**
     * Clears the vectorized claim of a document whose last file just went away. Call after the file
     * row is deleted.
     */
    @Transactional
    public boolean afterFileRemoved(UUID documentId) {
        Document document = documentRepository.findById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));

        if (fileRepository.countByDocumentId(documentId) > 0 || !document.vectorized()) {
            return false;
        }

        deleteChunksForDocument(documentId);
        documentRepository.updateVectorized(documentId, false, Map.of(
            DocumentMetadataKeys.VECTOR_DELETED_AT, Instant.now().toString(),
            DocumentMetadataKeys.VECTOR_DELETED_REASON, "Last file removed"
        ));
        log.info("Doc {}: last file removed, vectorized flag cleared", documentId);
        return true;
    }

    /**
     * Drops chunks of vectorized documents outside their validity window. A second call with the same
     * {@code now} finds nothing left to do.
     */
    @Transactional
    public int reconcileExpired(OffsetDateTime now) {
        List<Document> outdated = documentRepository.findVectorizedOutsideValidity(now);
        for (Document document : outdated) {
            int deleted = deleteChunksForDocument(document.id());
            documentRepository.updateVectorized(document.id(), false, Map.of(
                DocumentMetadataKeys.VECTOR_DELETED_BY, SYSTEM_ACTOR,
                DocumentMetadataKeys.VECTOR_DELETED_AT, Instant.now().toString(),
                DocumentMetadataKeys.VECTOR_DELETED_REASON, VALIDITY_REASON
            ));
            log.info("Doc {}: outside validity window, removed {} chunks", document.id(), deleted);
        }
        return outdated.size();
    }

    private List<DocumentChunk> buildChunks(Document document, DocumentFile file, List<String> chunkTexts) {
        List<DocumentChunk> chunks = new ArrayList<>(chunkTexts.size());
        String createdAt = Instant.now().toString();

        for (int index = 0; index < chunkTexts.size(); index++) {
            chunks.add(new DocumentChunk(
                null,
                document.id(),
                file != null ? file.id() : null,
                index,
                chunkTexts.get(index),
                vectorIndex.allocateId(),
                properties.embeddingModel(),
                properties.embeddingVersion(),
                chunkMetadata(document, file, index, chunkTexts.size(), createdAt),
                null
            ));
        }
        return chunks;
    }

    private static Map<String, Object> chunkMetadata(Document document, DocumentFile file, int index, int total, String createdAt) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (file != null) {
            metadata.put("file_id", file.id().toString());
            metadata.put("file_name", file.originalFilename());
            metadata.put("file_type", file.fileType());
        }
        metadata.put("chunk_index", index);
        metadata.put("total_chunks", total);
        metadata.put("document_title", document.title());
        metadata.put("document_tags", document.tags());
        metadata.put("created_at", createdAt);
        metadata.put("document_created_at", document.createdAt() != null ? document.createdAt().toString() : null);
        metadata.put("document_start_date", document.startDate() != null ? document.startDate().toString() : null);
        metadata.put("document_end_date", document.endDate() != null ? document.endDate().toString() : null);
        metadata.put("is_summary", file == null);
        return metadata;
    }

    private void removeVectors(UUID documentId, List<String> vectorIds) {
        if (vectorIds.isEmpty()) {
            return;
        }
        try {
            vectorIndex.delete(vectorIds);
        } catch (RuntimeException e) {
            log.warn("Doc {}: vector index delete of {} vectors failed: {}", documentId, vectorIds.size(), e.getMessage());
            if (documentId != null) {
                documentRepository.mergeMetadata(documentId, Map.of(
                    DocumentMetadataKeys.VECTOR_DELETE_ERROR, String.valueOf(e.getMessage()),
                    DocumentMetadataKeys.ERROR_TIME, Instant.now().toString()
                ));
            }
        }
    }
}
