package com.boardrag.pipeline;

import com.boardrag.pipeline.config.TaskProperties;
import com.boardrag.pipeline.model.DeferredTask;
import com.boardrag.pipeline.model.Document;
import com.boardrag.pipeline.model.DocumentFile;
import com.boardrag.pipeline.model.DocumentStatus;
import com.boardrag.pipeline.model.FileProcessingStatus;
import com.boardrag.pipeline.model.TaskStatus;
import com.boardrag.pipeline.model.TaskType;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class Fixtures {

    private Fixtures() {
    }

    public static TaskProperties fastTaskProperties() {
        return new TaskProperties(2, 3, Duration.ofMillis(10), Duration.ofMinutes(30),
            3, Duration.ofMillis(1), 3, Duration.ofMillis(1));
    }

    public static Document document(UUID id) {
        return document(id, "Board minutes", false);
    }

    public static Document document(UUID id, String summary, boolean vectorized) {
        OffsetDateTime now = OffsetDateTime.now();
        return new Document(id, "owner-1", "Board minutes", summary, List.of("board"), DocumentStatus.PENDING_APPROVAL,
            true, null, null, 0, 0, vectorized, Map.of(), now, now);
    }

    public static Document withStatus(Document document, DocumentStatus status) {
        return new Document(document.id(), document.ownerId(), document.title(), document.summary(), document.tags(),
            status, document.isPublic(), document.startDate(), document.endDate(), document.viewCount(),
            document.downloadCount(), document.vectorized(), document.metadata(), document.createdAt(), document.updatedAt());
    }

    public static Document withValidity(Document document, OffsetDateTime start, OffsetDateTime end) {
        return new Document(document.id(), document.ownerId(), document.title(), document.summary(), document.tags(),
            document.status(), document.isPublic(), start, end, document.viewCount(),
            document.downloadCount(), document.vectorized(), document.metadata(), document.createdAt(), document.updatedAt());
    }

    public static DocumentFile file(UUID id, UUID documentId, String filename, FileProcessingStatus status) {
        String extension = filename.substring(filename.lastIndexOf('.') + 1);
        OffsetDateTime now = OffsetDateTime.now();
        return new DocumentFile(id, documentId, UUID.randomUUID() + "." + extension, filename, extension, 5L,
            "application/octet-stream", status, Map.of(), null, now, now);
    }

    public static DocumentFile withStatus(DocumentFile file, FileProcessingStatus status, String error) {
        return new DocumentFile(file.id(), file.documentId(), file.storageKey(), file.originalFilename(), file.fileType(),
            file.fileSize(), file.contentType(), status, file.metadata(), error, file.createdAt(), file.updatedAt());
    }

    public static DeferredTask task(UUID id, TaskType type, TaskStatus status, Map<String, Object> payload, int attempts) {
        OffsetDateTime now = OffsetDateTime.now();
        return new DeferredTask(id, type, status, payload, null, null, attempts, 3, "worker-1", now, now,
            status == TaskStatus.PENDING ? null : now, null);
    }
}
