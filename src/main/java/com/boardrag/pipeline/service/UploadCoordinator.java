package com.boardrag.pipeline.service;

import com.boardrag.pipeline.exception.DocumentNotFoundException;
import com.boardrag.pipeline.exception.StorageException;
import com.boardrag.pipeline.infra.StagingArea;
import com.boardrag.pipeline.model.Document;
import com.boardrag.pipeline.model.DocumentFile;
import com.boardrag.pipeline.model.FileMetadataKeys;
import com.boardrag.pipeline.model.FileProcessingStatus;
import com.boardrag.pipeline.model.TaskType;
import com.boardrag.pipeline.repository.DocumentFileRepository;
import com.boardrag.pipeline.repository.DocumentRepository;
import com.boardrag.pipeline.task.TaskEnqueuer;
import com.boardrag.pipeline.task.TaskPayloads;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Accepts a batch of files for one document. Each file gets its row before any bytes move, so its
 * status can be tracked whatever happens to the upload afterwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadCoordinator {

    private final DocumentRepository documentRepository;
    private final DocumentFileRepository fileRepository;
    private final UploadValidator validator;
    private final StagingArea stagingArea;
    private final VerifiedUploader uploader;
    private final TaskEnqueuer taskEnqueuer;

    @Transactional
    public List<FileAcceptResult> acceptBatch(List<IncomingFile> files, String ownerId, UUID documentId, boolean deferred) {
        List<IncomingFile> batch = validator.validate(files);
        Optional<Document> document = resolveDocument(documentId, deferred);

        log.info("Accepting {} file(s) for document {} from {} ({})",
            batch.size(), documentId, ownerId, deferred ? "deferred" : "sync");

        List<FileAcceptResult> results = new ArrayList<>(batch.size());
        if (deferred) {
            List<Path> staged = new ArrayList<>();
            boolean cleanupRegistered = discardOnRollback(staged);
            try {
                for (IncomingFile file : batch) {
                    results.add(acceptDeferred(file, ownerId, document.orElseThrow(), staged));
                }
            } catch (RuntimeException e) {
                if (!cleanupRegistered) {
                    staged.forEach(stagingArea::discard);
                }
                throw e;
            }
        } else {
            for (IncomingFile file : batch) {
                results.add(acceptSync(file, ownerId, document.orElse(null)));
            }
        }
        return results;
    }

    public static String newStorageKey(String extension) {
        return extension.isEmpty() ? UUID.randomUUID().toString() : UUID.randomUUID() + "." + extension;
    }

    private Optional<Document> resolveDocument(UUID documentId, boolean deferred) {
        Optional<Document> document = documentId == null ? Optional.empty() : documentRepository.findById(documentId);
        if (document.isEmpty()) {
            if (deferred) {
                throw new DocumentNotFoundException(documentId);
            }
            log.warn("Document {} not found, uploading without file records", documentId);
        }
        return document;
    }

    private FileAcceptResult acceptDeferred(IncomingFile file, String ownerId, Document document, List<Path> staged) {
        String storageKey = newStorageKey(file.extension());
        DocumentFile row = createRow(file, ownerId, document.id(), storageKey, FileMetadataKeys.UPLOAD_TYPE_DEFERRED);

        Path stagedPath = stagingArea.stage(storageKey, file.content());
        staged.add(stagedPath);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TaskPayloads.STAGING_PATH, stagedPath.toString());
        payload.put(TaskPayloads.STORAGE_KEY, storageKey);
        payload.put(TaskPayloads.DOCUMENT_ID, document.id().toString());
        payload.put(TaskPayloads.FILE_ID, row.id().toString());
        UUID taskId = taskEnqueuer.enqueue(TaskType.UPLOAD_FILE, payload);

        DocumentFile processing = fileRepository.transition(row.id(), FileProcessingStatus.PROCESSING, null,
            Map.of(FileMetadataKeys.TASK_ID, taskId.toString()));

        return toResult(processing, taskId, null);
    }

    private FileAcceptResult acceptSync(IncomingFile file, String ownerId, Document document) {
        String storageKey = newStorageKey(file.extension());
        String contentType = contentTypeOf(file);

        DocumentFile row = null;
        if (document != null) {
            row = createRow(file, ownerId, document.id(), storageKey, FileMetadataKeys.UPLOAD_TYPE_SYNC);
            row = fileRepository.transition(row.id(), FileProcessingStatus.PROCESSING, null, Map.of());
        }

        Path stagedPath = null;
        try {
            stagedPath = stagingArea.stage(storageKey, file.content());
            UploadReceipt receipt = uploader.upload(storageKey, stagedPath, contentType);
            if (row == null) {
                return new FileAcceptResult(null, file.originalFilename(), storageKey, file.extension(),
                    receipt.size(), FileProcessingStatus.COMPLETED, null, null);
            }
            DocumentFile completed = fileRepository.transition(row.id(), FileProcessingStatus.COMPLETED, null,
                completionMetadata(receipt));
            return toResult(completed, null, null);
        } catch (StorageException e) {
            log.error("Synchronous upload of {} failed: {}", file.originalFilename(), e.getMessage());
            if (row == null) {
                return new FileAcceptResult(null, file.originalFilename(), storageKey, file.extension(),
                    file.size(), FileProcessingStatus.FAILED, null, e.getMessage());
            }
            DocumentFile failed = fileRepository.transition(row.id(), FileProcessingStatus.FAILED, e.getMessage(),
                Map.of(FileMetadataKeys.UPLOAD_ERROR, e.getMessage(),
                    FileMetadataKeys.ERROR_TIME, Instant.now().toString()));
            return toResult(failed, null, e.getMessage());
        } finally {
            stagingArea.discard(stagedPath);
        }
    }

    private DocumentFile createRow(IncomingFile file, String ownerId, UUID documentId, String storageKey, String uploadType) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(FileMetadataKeys.UPLOAD_TYPE, uploadType);
        metadata.put(FileMetadataKeys.UPLOADED_BY, ownerId);

        return fileRepository.save(new DocumentFile(
            null,
            documentId,
            storageKey,
            file.originalFilename(),
            file.extension(),
            file.size(),
            contentTypeOf(file),
            FileProcessingStatus.PENDING,
            metadata,
            null,
            null,
            null
        ));
    }

    public static Map<String, Object> completionMetadata(UploadReceipt receipt) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(FileMetadataKeys.UPLOAD_COMPLETED_AT, Instant.now().toString());
        metadata.put(FileMetadataKeys.FILE_SIZE, receipt.size());
        metadata.put(FileMetadataKeys.CONTENT_TYPE, receipt.contentType());
        metadata.put(FileMetadataKeys.UPLOAD_VALIDATION_SUCCESS, true);
        metadata.put(FileMetadataKeys.UPLOAD_ATTEMPTS, receipt.uploadAttempts());
        metadata.put(FileMetadataKeys.VALIDATION_ATTEMPTS, receipt.validationAttempts());
        return metadata;
    }

    private static String contentTypeOf(IncomingFile file) {
        return file.contentType() != null ? file.contentType() : VerifiedUploader.contentTypeFor(file.originalFilename());
    }

    private static FileAcceptResult toResult(DocumentFile file, UUID taskId, String error) {
        return new FileAcceptResult(
            file.id(),
            file.originalFilename(),
            file.storageKey(),
            file.fileType(),
            file.fileSize(),
            file.processingStatus(),
            taskId,
            error
        );
    }

    private boolean discardOnRollback(List<Path> staged) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return false;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_COMMITTED) {
                    staged.forEach(stagingArea::discard);
                }
            }
        });
        return true;
    }
}
