package com.boardrag.pipeline.service;

import com.boardrag.pipeline.config.StorageProperties;
import com.boardrag.pipeline.config.UploadProperties;
import com.boardrag.pipeline.exception.DocumentFileNotFoundException;
import com.boardrag.pipeline.exception.DocumentNotFoundException;
import com.boardrag.pipeline.exception.FileValidationException;
import com.boardrag.pipeline.exception.IllegalStatusTransitionException;
import com.boardrag.pipeline.exception.StorageException;
import com.boardrag.pipeline.infra.ObjectStore;
import com.boardrag.pipeline.infra.ObjectStream;
import com.boardrag.pipeline.infra.StagingArea;
import com.boardrag.pipeline.model.Document;
import com.boardrag.pipeline.model.DocumentChunk;
import com.boardrag.pipeline.model.DocumentFile;
import com.boardrag.pipeline.model.DocumentMetadataKeys;
import com.boardrag.pipeline.model.DocumentStatus;
import com.boardrag.pipeline.model.FileMetadataKeys;
import com.boardrag.pipeline.model.FileProcessingStatus;
import com.boardrag.pipeline.model.TaskType;
import com.boardrag.pipeline.repository.DocumentChunkRepository;
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
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    private final DocumentRepository documentRepository;
    private final DocumentFileRepository fileRepository;
    private final DocumentChunkRepository chunkRepository;
    private final UploadCoordinator uploadCoordinator;
    private final UploadValidator uploadValidator;
    private final ChunkLifecycleService chunkLifecycle;
    private final StagingArea stagingArea;
    private final ObjectStore objectStore;
    private final TaskEnqueuer taskEnqueuer;
    private final UploadProperties uploadProperties;
    private final StorageProperties storageProperties;

    @Override
    @Transactional
    public DocumentCreateResult createDocument(CreateDocumentCommand command, List<IncomingFile> files, boolean deferred) {
        uploadValidator.validate(files);
        log.debug("Creating document '{}' for {}", command.title(), command.ownerId());

        Document document = documentRepository.save(Document.newDocument(
            command.ownerId(),
            command.title(),
            command.summary(),
            command.tags(),
            command.isPublic(),
            command.startDate(),
            command.endDate()
        ));

        List<FileAcceptResult> accepted = uploadCoordinator.acceptBatch(files, command.ownerId(), document.id(), deferred);

        UUID mainTaskId = accepted.stream()
            .map(FileAcceptResult::taskId)
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(null);
        if (mainTaskId != null) {
            documentRepository.mergeMetadata(document.id(), Map.of(DocumentMetadataKeys.MAIN_TASK_ID, mainTaskId.toString()));
        }

        log.info("Doc {}: created with {} file(s)", document.id(), accepted.size());
        return new DocumentCreateResult(getById(document.id()), accepted, mainTaskId);
    }

    @Override
    @Transactional(readOnly = true)
    public Document getById(UUID id) {
        return documentRepository.findById(id)
            .orElseThrow(() -> {
                log.warn("Document not found with ID: {}", id);
                return new DocumentNotFoundException(id);
            });
    }

    @Override
    @Transactional
    public List<FileAcceptResult> addFiles(UUID documentId, List<IncomingFile> files, String requestedBy) {
        getById(documentId);
        List<FileAcceptResult> accepted = uploadCoordinator.acceptBatch(files, requestedBy, documentId, true);
        documentRepository.updateStatus(documentId, DocumentStatus.PENDING_APPROVAL, Map.of());
        log.info("Doc {}: {} file(s) added by {}, back to review", documentId, accepted.size(), requestedBy);
        return accepted;
    }

    @Override
    @Transactional(readOnly = true)
    public List<FileStatusView> getFileStatuses(UUID documentId) {
        getById(documentId);
        return fileRepository.findByDocumentId(documentId).stream()
            .map(file -> new FileStatusView(file, existsInStorage(file)))
            .toList();
    }

    @Override
    @Transactional
    public FileAcceptResult reupload(UUID documentId, UUID fileId, IncomingFile incoming, String requestedBy) {
        DocumentFile file = findFile(documentId, fileId);

        if (!Objects.equals(file.originalFilename(), incoming.originalFilename())) {
            throw new FileValidationException(incoming.originalFilename(),
                "Filename must match the original: expected " + file.originalFilename());
        }
        uploadValidator.validateFile(incoming);
        if (!file.processingStatus().canTransitionTo(FileProcessingStatus.PROCESSING)) {
            throw new IllegalStatusTransitionException(fileId, file.processingStatus(), FileProcessingStatus.PROCESSING);
        }

        chunkLifecycle.deleteChunksForFile(fileId);

        Path staged = stagingArea.stage(file.storageKey(), incoming.content());
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(TaskPayloads.STAGING_PATH, staged.toString());
            payload.put(TaskPayloads.STORAGE_KEY, file.storageKey());
            payload.put(TaskPayloads.DOCUMENT_ID, documentId.toString());
            payload.put(TaskPayloads.FILE_ID, fileId.toString());
            UUID taskId = taskEnqueuer.enqueue(TaskType.UPLOAD_FILE, payload);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(FileMetadataKeys.REUPLOADED_BY, requestedBy);
            metadata.put(FileMetadataKeys.REUPLOADED_AT, Instant.now().toString());
            metadata.put(FileMetadataKeys.ORIGINAL_ERROR, file.errorMessage());
            metadata.put(FileMetadataKeys.REUPLOAD_TASK_ID, taskId.toString());
            metadata.put(FileMetadataKeys.TASK_ID, taskId.toString());
            DocumentFile processing = fileRepository.transition(fileId, FileProcessingStatus.PROCESSING, null, metadata);

            log.info("File {}: reupload queued as task {} by {}", fileId, taskId, requestedBy);
            return new FileAcceptResult(processing.id(), processing.originalFilename(), processing.storageKey(),
                processing.fileType(), incoming.size(), processing.processingStatus(), taskId, null);
        } catch (RuntimeException e) {
            stagingArea.discard(staged);
            throw e;
        }
    }

    @Override
    @Transactional
    public void removeFile(UUID documentId, UUID fileId) {
        DocumentFile file = findFile(documentId, fileId);

        chunkLifecycle.deleteChunksForFile(fileId);
        fileRepository.deleteById(fileId);
        chunkLifecycle.afterFileRemoved(documentId);

        runAfterCommit(() -> deleteStoredObject(file.storageKey()));
        log.info("Doc {}: removed file {}", documentId, fileId);
    }

    @Override
    @Transactional
    public DocumentFile setFileVisibility(UUID documentId, UUID fileId, boolean isPublic, String requestedBy) {
        findFile(documentId, fileId);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(FileMetadataKeys.IS_PUBLIC, isPublic);
        metadata.put(FileMetadataKeys.VISIBILITY_CHANGED_BY, requestedBy);
        metadata.put(FileMetadataKeys.VISIBILITY_CHANGED_AT, Instant.now().toString());
        fileRepository.mergeMetadata(fileId, metadata);
        return fileRepository.findById(fileId).orElseThrow(() -> new DocumentFileNotFoundException(fileId));
    }

    @Override
    @Transactional(readOnly = true)
    public DownloadLink downloadUrl(UUID documentId, UUID fileId, Duration ttl) {
        DocumentFile file = findFile(documentId, fileId);
        Duration effectiveTtl = ttl != null ? ttl : storageProperties.presignTtl();
        String url = objectStore.presignGet(file.storageKey(), effectiveTtl);
        return new DownloadLink(fileId, file.originalFilename(), url, Instant.now().plus(effectiveTtl));
    }

    @Override
    @Transactional
    public FileDownload openDownload(UUID documentId, UUID fileId) {
        DocumentFile file = findFile(documentId, fileId);
        ObjectStream stream = objectStore.streamGet(file.storageKey());
        documentRepository.incrementDownloadCount(documentId);
        return new FileDownload(file, stream);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DocumentChunk> listChunks(UUID documentId) {
        getById(documentId);
        return chunkRepository.findByDocumentId(documentId);
    }

    @Override
    public Map<String, DataSize> supportedTypes() {
        return new TreeMap<>(uploadProperties.allowedTypes());
    }

    private DocumentFile findFile(UUID documentId, UUID fileId) {
        return fileRepository.findById(fileId)
            .filter(file -> file.documentId().equals(documentId))
            .orElseThrow(() -> new DocumentFileNotFoundException(fileId));
    }

    private boolean existsInStorage(DocumentFile file) {
        try {
            return objectStore.exists(file.storageKey());
        } catch (StorageException e) {
            log.warn("File {}: storage probe failed: {}", file.id(), e.getMessage());
            return false;
        }
    }

    private void deleteStoredObject(String storageKey) {
        try {
            objectStore.delete(storageKey);
        } catch (StorageException e) {
            log.warn("Object {} left in storage after file removal: {}", storageKey, e.getMessage());
        }
    }

    private static void runAfterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }
}
