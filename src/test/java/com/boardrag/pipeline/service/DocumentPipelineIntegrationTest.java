package com.boardrag.pipeline.service;

import com.boardrag.pipeline.infra.ObjectStore;
import com.boardrag.pipeline.model.Document;
import com.boardrag.pipeline.model.DocumentChunk;
import com.boardrag.pipeline.model.DocumentStatus;
import com.boardrag.pipeline.model.FileProcessingStatus;
import com.boardrag.pipeline.model.TaskStatus;
import com.boardrag.pipeline.repository.BaseIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class DocumentPipelineIntegrationTest extends BaseIntegrationTest {

    private static final String MINUTES = "The board approved the budget. The next meeting is in March. "
        + "Members discussed the new office lease and agreed to revisit it next quarter.";

    @Autowired
    private DocumentService documentService;

    @Autowired
    private ReviewService reviewService;

    @Autowired
    private VectorizationService vectorizationService;

    @Autowired
    private TaskService taskService;

    @Autowired
    private ObjectStore objectStore;

    private static CreateDocumentCommand command(String summary) {
        return new CreateDocumentCommand("owner-1", "Board minutes", summary, List.of("board"), true, null, null);
    }

    private void awaitTask(UUID taskId, TaskStatus expected) {
        await().atMost(30, TimeUnit.SECONDS)
            .pollInterval(200, TimeUnit.MILLISECONDS)
            .until(() -> taskService.getTask(taskId).status() == expected);
    }

    @Test
    @DisplayName("Should upload in the background, vectorize after approval and drop vectors on request")
    void shouldRunDeferredPipeline() throws Exception {
        DocumentCreateResult created = documentService.createDocument(command("Budget approved."),
            List.of(IncomingFile.of("minutes.txt", MINUTES.getBytes(StandardCharsets.UTF_8))), true);
        UUID documentId = created.document().id();
        FileAcceptResult accepted = created.files().get(0);

        assertThat(created.mainTaskId()).isEqualTo(accepted.taskId());
        assertThat(accepted.status()).isEqualTo(FileProcessingStatus.PROCESSING);

        awaitTask(accepted.taskId(), TaskStatus.SUCCESS);
        FileStatusView status = documentService.getFileStatuses(documentId).get(0);
        assertThat(status.file().processingStatus()).isEqualTo(FileProcessingStatus.COMPLETED);
        assertThat(status.existsInStorage()).isTrue();

        try (var download = documentService.openDownload(documentId, accepted.fileId()).stream()) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            download.transferTo(out);
            assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo(MINUTES);
        }
        assertThat(documentService.getById(documentId).downloadCount()).isEqualTo(1);

        Document approved = reviewService.approve(documentId, "admin-1");
        assertThat(approved.status()).isEqualTo(DocumentStatus.APPROVED);

        UUID vectorizeTask = vectorizationService.requestVectorization(documentId, true, false, "admin-1");
        awaitTask(vectorizeTask, TaskStatus.SUCCESS);

        List<DocumentChunk> chunks = documentService.listChunks(documentId);
        assertThat(chunks).isNotEmpty();
        assertThat(chunks).anyMatch(chunk -> chunk.fileId() == null);
        assertThat(chunks).anyMatch(chunk -> accepted.fileId().equals(chunk.fileId()));
        assertThat(documentService.getById(documentId).vectorized()).isTrue();

        UUID deleteTask = vectorizationService.requestVectorDeletion(documentId, "admin-1");
        awaitTask(deleteTask, TaskStatus.SUCCESS);

        assertThat(documentService.listChunks(documentId)).isEmpty();
        assertThat(documentService.getById(documentId).vectorized()).isFalse();
    }

    @Test
    @DisplayName("Should complete a synchronous upload before returning")
    void shouldUploadSynchronously() {
        DocumentCreateResult created = documentService.createDocument(command(null),
            List.of(IncomingFile.of("agenda.txt", "Agenda".getBytes(StandardCharsets.UTF_8))), false);

        FileAcceptResult accepted = created.files().get(0);
        assertThat(accepted.status()).isEqualTo(FileProcessingStatus.COMPLETED);
        assertThat(accepted.taskId()).isNull();
        assertThat(objectStore.exists(accepted.storageKey())).isTrue();
    }

    @Test
    @DisplayName("Should clear the vectorized flag when the last file is removed")
    void shouldUnvectorizeWhenLastFileRemoved() {
        DocumentCreateResult created = documentService.createDocument(command("Short summary."),
            List.of(IncomingFile.of("notes.txt", MINUTES.getBytes(StandardCharsets.UTF_8))), false);
        UUID documentId = created.document().id();
        UUID fileId = created.files().get(0).fileId();

        UUID vectorizeTask = vectorizationService.requestVectorization(documentId, true, false, "admin-1");
        awaitTask(vectorizeTask, TaskStatus.SUCCESS);
        assertThat(documentService.getById(documentId).vectorized()).isTrue();

        documentService.removeFile(documentId, fileId);

        assertThat(documentService.getById(documentId).vectorized()).isFalse();
        assertThat(documentService.listChunks(documentId)).isEmpty();
        await().atMost(10, TimeUnit.SECONDS)
            .until(() -> !objectStore.exists(created.files().get(0).storageKey()));
    }
}
