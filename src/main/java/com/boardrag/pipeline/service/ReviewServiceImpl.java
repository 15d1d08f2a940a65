package com.boardrag.pipeline.service;

import com.boardrag.pipeline.exception.DocumentNotFoundException;
import com.boardrag.pipeline.model.Document;
import com.boardrag.pipeline.model.DocumentMetadataKeys;
import com.boardrag.pipeline.model.DocumentStatus;
import com.boardrag.pipeline.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Approval workflow. A rejected document goes back to {@code PENDING_APPROVAL} with the reason
 * recorded, so the owner can fix it and resubmit.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReviewServiceImpl implements ReviewService {

    private final DocumentRepository documentRepository;

    @Override
    @Transactional
    public Document approve(UUID documentId, String adminId) {
        Document document = load(documentId);
        if (document.status() != DocumentStatus.APPROVED) {
            documentRepository.updateStatus(documentId, DocumentStatus.APPROVED, approval(adminId, false));
            log.info("Doc {}: approved by {}", documentId, adminId);
        }
        return load(documentId);
    }

    @Override
    @Transactional
    public Document reject(UUID documentId, String reason, String adminId) {
        load(documentId);
        documentRepository.updateStatus(documentId, DocumentStatus.PENDING_APPROVAL, rejection(reason, adminId, false));
        log.info("Doc {}: rejected by {}", documentId, adminId);
        return load(documentId);
    }

    @Override
    @Transactional
    public BatchResult approveAll(List<UUID> documentIds, String adminId) {
        Map<UUID, Document> found = loadAll(documentIds);
        List<UUID> succeeded = new ArrayList<>();
        List<BatchResult.BatchFailure> failed = new ArrayList<>();

        for (UUID id : new LinkedHashSet<>(documentIds)) {
            Document document = found.get(id);
            if (document == null) {
                failed.add(new BatchResult.BatchFailure(id, "Document not found"));
                continue;
            }
            if (document.status() != DocumentStatus.APPROVED) {
                documentRepository.updateStatus(id, DocumentStatus.APPROVED, approval(adminId, true));
            }
            succeeded.add(id);
        }

        log.info("Batch approval by {}: {} succeeded, {} failed", adminId, succeeded.size(), failed.size());
        return new BatchResult(succeeded, failed);
    }

    @Override
    @Transactional
    public BatchResult rejectAll(List<UUID> documentIds, String reason, String adminId) {
        Map<UUID, Document> found = loadAll(documentIds);
        List<UUID> succeeded = new ArrayList<>();
        List<BatchResult.BatchFailure> failed = new ArrayList<>();

        for (UUID id : new LinkedHashSet<>(documentIds)) {
            if (!found.containsKey(id)) {
                failed.add(new BatchResult.BatchFailure(id, "Document not found"));
                continue;
            }
            documentRepository.updateStatus(id, DocumentStatus.PENDING_APPROVAL, rejection(reason, adminId, true));
            succeeded.add(id);
        }

        log.info("Batch rejection by {}: {} succeeded, {} failed", adminId, succeeded.size(), failed.size());
        return new BatchResult(succeeded, failed);
    }

    private Document load(UUID documentId) {
        return documentRepository.findById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    private Map<UUID, Document> loadAll(List<UUID> documentIds) {
        return documentRepository.findAllById(documentIds).stream()
            .collect(Collectors.toMap(Document::id, Function.identity()));
    }

    private static Map<String, Object> approval(String adminId, boolean batch) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(DocumentMetadataKeys.APPROVED_BY, adminId);
        metadata.put(DocumentMetadataKeys.APPROVED_AT, Instant.now().toString());
        if (batch) {
            metadata.put(DocumentMetadataKeys.BATCH_APPROVAL, true);
        }
        return metadata;
    }

    private static Map<String, Object> rejection(String reason, String adminId, boolean batch) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(DocumentMetadataKeys.REJECTED_BY, adminId);
        metadata.put(DocumentMetadataKeys.REJECTED_AT, Instant.now().toString());
        metadata.put(DocumentMetadataKeys.REJECT_REASON, reason);
        if (batch) {
            metadata.put(DocumentMetadataKeys.BATCH_REJECTION, true);
        }
        return metadata;
    }
}
