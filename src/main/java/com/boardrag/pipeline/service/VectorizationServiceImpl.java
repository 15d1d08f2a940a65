package com.boardrag.pipeline.service;

import com.boardrag.pipeline.exception.DocumentNotFoundException;
import com.boardrag.pipeline.exception.DocumentValidityException;
import com.boardrag.pipeline.exception.InvalidDocumentStateException;
import com.boardrag.pipeline.model.Document;
import com.boardrag.pipeline.model.DocumentMetadataKeys;
import com.boardrag.pipeline.model.TaskType;
import com.boardrag.pipeline.repository.DocumentFileRepository;
import com.boardrag.pipeline.repository.DocumentRepository;
import com.boardrag.pipeline.task.TaskEnqueuer;
import com.boardrag.pipeline.task.TaskPayloads;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class VectorizationServiceImpl implements VectorizationService {

    private final DocumentRepository documentRepository;
    private final DocumentFileRepository fileRepository;
    private final ChunkLifecycleService chunkLifecycle;
    private final TaskEnqueuer taskEnqueuer;

    @Override
    @Transactional
    public UUID requestVectorization(UUID documentId, boolean fullVectorize, boolean force, String adminId) {
        Document document = documentRepository.findById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));

        if (!force && !document.isValidAt(OffsetDateTime.now())) {
            throw new DocumentValidityException(documentId,
                "Document " + documentId + " is outside its validity window; use force to vectorize anyway");
        }
        if (fileRepository.countByDocumentId(documentId) == 0) {
            throw new InvalidDocumentStateException(documentId, "Document " + documentId + " has no files");
        }
        if (!fullVectorize && !document.hasSummary()) {
            throw new InvalidDocumentStateException(documentId,
                "Document " + documentId + " has no summary; request a full vectorization instead");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TaskPayloads.DOCUMENT_ID, documentId.toString());
        payload.put(TaskPayloads.FULL_VECTORIZE, fullVectorize);
        payload.put(TaskPayloads.REQUESTED_BY, adminId);
        UUID taskId = taskEnqueuer.enqueue(TaskType.VECTORIZE_DOCUMENT, payload);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(DocumentMetadataKeys.VECTORIZE_REQUESTED_BY, adminId);
        metadata.put(DocumentMetadataKeys.VECTORIZE_REQUESTED_AT, Instant.now().toString());
        metadata.put(DocumentMetadataKeys.FULL_VECTORIZE, fullVectorize);
        metadata.put(DocumentMetadataKeys.FORCE_VECTORIZE, force);
        metadata.put(DocumentMetadataKeys.VECTORIZE_TASK_ID, taskId.toString());
        documentRepository.updateVectorized(documentId, false, metadata);

        log.info("Doc {}: vectorization ({}) requested by {} as task {}",
            documentId, fullVectorize ? "full" : "summary", adminId, taskId);
        return taskId;
    }

    @Override
    @Transactional
    public UUID requestVectorDeletion(UUID documentId, String adminId) {
        if (documentRepository.findById(documentId).isEmpty()) {
            throw new DocumentNotFoundException(documentId);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TaskPayloads.DOCUMENT_ID, documentId.toString());
        payload.put(TaskPayloads.REQUESTED_BY, adminId);
        UUID taskId = taskEnqueuer.enqueue(TaskType.DELETE_VECTORS, payload);

        documentRepository.mergeMetadata(documentId, Map.of(
            DocumentMetadataKeys.VECTOR_DELETE_REQUESTED_BY, adminId,
            DocumentMetadataKeys.VECTOR_DELETE_TASK_ID, taskId.toString()
        ));
        log.info("Doc {}: vector deletion requested by {} as task {}", documentId, adminId, taskId);
        return taskId;
    }

    @Override
    public int reconcileExpired() {
        return chunkLifecycle.reconcileExpired(OffsetDateTime.now());
    }
}
