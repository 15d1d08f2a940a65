package com.boardrag.pipeline.task;

import com.boardrag.pipeline.chunking.TextExtractor;
import com.boardrag.pipeline.chunking.TokenWindowChunker;
import com.boardrag.pipeline.exception.DocumentNotFoundException;
import com.boardrag.pipeline.exception.StorageException;
import com.boardrag.pipeline.exception.TaskExecutionException;
import com.boardrag.pipeline.exception.TextExtractionException;
import com.boardrag.pipeline.exception.UnsupportedFileTypeException;
import com.boardrag.pipeline.model.DeferredTask;
import com.boardrag.pipeline.model.Document;
import com.boardrag.pipeline.model.DocumentFile;
import com.boardrag.pipeline.model.DocumentMetadataKeys;
import com.boardrag.pipeline.model.FileProcessingStatus;
import com.boardrag.pipeline.model.TaskType;
import com.boardrag.pipeline.repository.DocumentFileRepository;
import com.boardrag.pipeline.repository.DocumentRepository;
import com.boardrag.pipeline.service.ChunkLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Produces chunks for a document. Summary mode chunks only the summary; full mode also extracts
 * every completed file. A file that cannot be read is recorded and skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VectorizeDocumentTaskHandler implements TaskHandler {

    private final DocumentRepository documentRepository;
    private final DocumentFileRepository fileRepository;
    private final TextExtractor textExtractor;
    private final TokenWindowChunker tokenChunker;
    private final ChunkLifecycleService chunkLifecycle;

    @Override
    public TaskType type() {
        return TaskType.VECTORIZE_DOCUMENT;
    }

    @Override
    public Map<String, Object> handle(DeferredTask task) {
        UUID documentId = TaskPayloads.requireUuid(task.payload(), TaskPayloads.DOCUMENT_ID);
        boolean full = TaskPayloads.flag(task.payload(), TaskPayloads.FULL_VECTORIZE);

        Document document = documentRepository.findById(documentId)
            .orElseThrow(() -> TaskExecutionException.fatal("Document missing", new DocumentNotFoundException(documentId)));

        int fileChunks = 0;
        Map<String, String> fileErrors = new LinkedHashMap<>();
        if (full) {
            for (DocumentFile file : fileRepository.findByDocumentIdAndStatus(documentId, FileProcessingStatus.COMPLETED)) {
                fileChunks += vectorizeFile(task, document, file, fileErrors);
            }
        }
        int summaryChunks = chunkLifecycle.createChunksForSummary(document).size();
        int total = fileChunks + summaryChunks;

        if (total == 0) {
            documentRepository.mergeMetadata(documentId, Map.of(
                DocumentMetadataKeys.VECTORIZE_ERROR, "No chunks produced",
                DocumentMetadataKeys.VECTORIZE_FILE_ERRORS, fileErrors,
                DocumentMetadataKeys.ERROR_TIME, Instant.now().toString()
            ));
            throw TaskExecutionException.fatal("Document " + documentId + " produced no chunks");
        }

        Map<String, Object> extra = new LinkedHashMap<>();
        if (!fileErrors.isEmpty()) {
            extra.put(DocumentMetadataKeys.VECTORIZE_FILE_ERRORS, fileErrors);
        }
        chunkLifecycle.markVectorized(documentId, total, extra);
        log.info("Task {}: document {} vectorized with {} chunks ({} from files, {} failed files)",
            task.id(), documentId, total, fileChunks, fileErrors.size());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "success");
        result.put("document_id", documentId.toString());
        result.put("full_vectorize", full);
        result.put("chunk_count", total);
        result.put("summary_chunk_count", summaryChunks);
        result.put("file_errors", fileErrors);
        return result;
    }

    private int vectorizeFile(DeferredTask task, Document document, DocumentFile file, Map<String, String> fileErrors) {
        if (!TextExtractor.supports(file.fileType())) {
            fileErrors.put(file.id().toString(), new UnsupportedFileTypeException(file.fileType()).getMessage());
            return 0;
        }
        try {
            String text = textExtractor.extractText(file.storageKey(), file.fileType());
            List<String> chunks = tokenChunker.chunk(text);
            if (chunks.isEmpty()) {
                log.warn("Task {}: file {} has no extractable text", task.id(), file.id());
                return 0;
            }
            return chunkLifecycle.createChunksForFile(document, file, chunks).size();
        } catch (TextExtractionException | StorageException e) {
            log.warn("Task {}: extraction of {} failed: {}", task.id(), file.originalFilename(), e.getMessage());
            fileErrors.put(file.id().toString(), e.getMessage());
            return 0;
        }
    }
}
