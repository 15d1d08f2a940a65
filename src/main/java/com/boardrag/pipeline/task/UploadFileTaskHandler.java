package com.boardrag.pipeline.task;

import com.boardrag.pipeline.exception.DocumentFileNotFoundException;
import com.boardrag.pipeline.exception.StorageException;
import com.boardrag.pipeline.exception.TaskExecutionException;
import com.boardrag.pipeline.infra.StagingArea;
import com.boardrag.pipeline.model.DeferredTask;
import com.boardrag.pipeline.model.DocumentFile;
import com.boardrag.pipeline.model.FileMetadataKeys;
import com.boardrag.pipeline.model.FileProcessingStatus;
import com.boardrag.pipeline.model.TaskType;
import com.boardrag.pipeline.repository.DocumentFileRepository;
import com.boardrag.pipeline.service.UploadCoordinator;
import com.boardrag.pipeline.service.UploadReceipt;
import com.boardrag.pipeline.service.VerifiedUploader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Moves a staged file into the object store. Every failure leaves the file row in {@code FAILED}
 * before the task is reported as failed, so a retry always starts from a known state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UploadFileTaskHandler implements TaskHandler {

    private final DocumentFileRepository fileRepository;
    private final StagingArea stagingArea;
    private final VerifiedUploader uploader;

    @Override
    public TaskType type() {
        return TaskType.UPLOAD_FILE;
    }

    @Override
    public Map<String, Object> handle(DeferredTask task) {
        Map<String, Object> payload = task.payload();
        Path stagedPath = Path.of(TaskPayloads.requireString(payload, TaskPayloads.STAGING_PATH));
        String storageKey = TaskPayloads.requireString(payload, TaskPayloads.STORAGE_KEY);
        UUID fileId = TaskPayloads.requireUuid(payload, TaskPayloads.FILE_ID);

        DocumentFile file = fileRepository.findById(fileId)
            .orElseThrow(() -> TaskExecutionException.fatal("File record missing", new DocumentFileNotFoundException(fileId)));

        if (file.processingStatus() == FileProcessingStatus.COMPLETED) {
            log.info("Task {}: file {} already uploaded, nothing to do", task.id(), fileId);
            stagingArea.discard(stagedPath);
            return result(file, storageKey, file.fileSize());
        }

        if (!Files.exists(stagedPath)) {
            markFailed(file, "Staged file not found: " + stagedPath);
            throw TaskExecutionException.retryable("Staged file not found: " + stagedPath);
        }

        long size = sizeOf(stagedPath);
        if (size == 0) {
            markFailed(file, "Staged file is empty");
            stagingArea.discard(stagedPath);
            throw TaskExecutionException.fatal("Staged file is empty: " + stagedPath);
        }

        if (file.processingStatus() != FileProcessingStatus.PROCESSING) {
            file = fileRepository.transition(fileId, FileProcessingStatus.PROCESSING, null, Map.of());
        }

        UploadReceipt receipt;
        try {
            receipt = uploader.upload(storageKey, stagedPath, file.contentType());
        } catch (StorageException e) {
            log.error("Task {}: upload of {} failed: {}", task.id(), storageKey, e.getMessage());
            markFailed(file, e.getMessage());
            throw TaskExecutionException.retryable("Upload of " + storageKey + " failed: " + e.getMessage(), e);
        }

        Map<String, Object> metadata = UploadCoordinator.completionMetadata(receipt);
        metadata.put(FileMetadataKeys.UPLOAD_TASK_ID, task.id().toString());
        DocumentFile completed = fileRepository.transition(fileId, FileProcessingStatus.COMPLETED, null, metadata);
        stagingArea.discard(stagedPath);

        log.info("Task {}: uploaded {} ({} bytes)", task.id(), storageKey, receipt.size());
        return result(completed, storageKey, receipt.size());
    }

    private void markFailed(DocumentFile file, String error) {
        Map<String, Object> metadata = Map.of(
            FileMetadataKeys.UPLOAD_ERROR, error,
            FileMetadataKeys.ERROR_TIME, Instant.now().toString()
        );
        FileProcessingStatus current = fileRepository.findById(file.id())
            .map(DocumentFile::processingStatus)
            .orElse(file.processingStatus());

        if (current == FileProcessingStatus.FAILED) {
            fileRepository.mergeMetadata(file.id(), metadata);
            return;
        }
        if (current == FileProcessingStatus.PENDING) {
            fileRepository.transition(file.id(), FileProcessingStatus.PROCESSING, null, Map.of());
        }
        fileRepository.transition(file.id(), FileProcessingStatus.FAILED, error, metadata);
    }

    private static Map<String, Object> result(DocumentFile file, String storageKey, long size) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "success");
        result.put("file_id", file.id().toString());
        result.put("storage_key", storageKey);
        result.put("file_size", size);
        return result;
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw TaskExecutionException.retryable("Cannot read staged file " + path, e);
        }
    }
}
