package com.boardrag.pipeline.task;

import com.boardrag.pipeline.exception.TaskExecutionException;
import com.boardrag.pipeline.model.DeferredTask;
import com.boardrag.pipeline.model.DocumentMetadataKeys;
import com.boardrag.pipeline.model.TaskType;
import com.boardrag.pipeline.repository.DocumentRepository;
import com.boardrag.pipeline.service.ChunkLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class DeleteVectorsTaskHandler implements TaskHandler {

    private final DocumentRepository documentRepository;
    private final ChunkLifecycleService chunkLifecycle;

    @Override
    public TaskType type() {
        return TaskType.DELETE_VECTORS;
    }

    @Override
    public Map<String, Object> handle(DeferredTask task) {
        UUID documentId = TaskPayloads.requireUuid(task.payload(), TaskPayloads.DOCUMENT_ID);

        int deleted;
        try {
            deleted = chunkLifecycle.deleteChunksForDocument(documentId);
        } catch (DataAccessException e) {
            documentRepository.mergeMetadata(documentId, Map.of(
                DocumentMetadataKeys.VECTOR_DELETE_ERROR, String.valueOf(e.getMessage()),
                DocumentMetadataKeys.ERROR_TIME, Instant.now().toString()
            ));
            throw TaskExecutionException.retryable("Chunk delete for " + documentId + " failed", e);
        }

        documentRepository.updateVectorized(documentId, false, Map.of(
            DocumentMetadataKeys.VECTOR_DELETED_AT, Instant.now().toString(),
            DocumentMetadataKeys.VECTOR_DELETED_BY_TASK, task.id().toString()
        ));
        log.info("Task {}: removed {} chunks of document {}", task.id(), deleted, documentId);

        return Map.of(
            "status", "success",
            "document_id", documentId.toString(),
            "deleted_chunks", deleted
        );
    }
}
