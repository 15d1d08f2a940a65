package com.boardrag.pipeline.service;

import com.boardrag.pipeline.Fixtures;
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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VectorizationServiceImplTest {

    @Mock
    private DocumentRepository documentRepository;

    @Mock
    private DocumentFileRepository fileRepository;

    @Mock
    private ChunkLifecycleService chunkLifecycle;

    @Mock
    private TaskEnqueuer taskEnqueuer;

    @InjectMocks
    private VectorizationServiceImpl vectorizationService;

    private final UUID documentId = UUID.randomUUID();

    @Nested
    @DisplayName("Vectorization requests")
    class Vectorize {

        @Test
        @DisplayName("Should enqueue a full vectorization and reset the vectorized flag")
        void shouldEnqueueFullVectorization() {
            UUID taskId = UUID.randomUUID();
            when(documentRepository.findById(documentId)).thenReturn(Optional.of(Fixtures.document(documentId)));
            when(fileRepository.countByDocumentId(documentId)).thenReturn(2);
            when(taskEnqueuer.enqueue(eq(TaskType.VECTORIZE_DOCUMENT), anyMap())).thenReturn(taskId);

            UUID result = vectorizationService.requestVectorization(documentId, true, false, "admin-1");

            assertThat(result).isEqualTo(taskId);
            verify(taskEnqueuer).enqueue(eq(TaskType.VECTORIZE_DOCUMENT), argThat(payload ->
                documentId.toString().equals(payload.get(TaskPayloads.DOCUMENT_ID))
                    && Boolean.TRUE.equals(payload.get(TaskPayloads.FULL_VECTORIZE))));
            verify(documentRepository).updateVectorized(eq(documentId), eq(false), argThat(metadata ->
                taskId.toString().equals(metadata.get(DocumentMetadataKeys.VECTORIZE_TASK_ID))
                    && "admin-1".equals(metadata.get(DocumentMetadataKeys.VECTORIZE_REQUESTED_BY))));
        }

        @Test
        @DisplayName("Should refuse an expired document unless forced")
        void shouldRespectValidityWindow() {
            Document expired = Fixtures.withValidity(Fixtures.document(documentId), null, OffsetDateTime.now().minusDays(1));
            when(documentRepository.findById(documentId)).thenReturn(Optional.of(expired));

            assertThatThrownBy(() -> vectorizationService.requestVectorization(documentId, true, false, "admin-1"))
                .isInstanceOf(DocumentValidityException.class);
            verifyNoInteractions(taskEnqueuer);

            when(fileRepository.countByDocumentId(documentId)).thenReturn(1);
            when(taskEnqueuer.enqueue(any(), anyMap())).thenReturn(UUID.randomUUID());
            assertThat(vectorizationService.requestVectorization(documentId, true, true, "admin-1")).isNotNull();
        }

        @Test
        @DisplayName("Should refuse a document without files")
        void shouldRequireFiles() {
            when(documentRepository.findById(documentId)).thenReturn(Optional.of(Fixtures.document(documentId)));
            when(fileRepository.countByDocumentId(documentId)).thenReturn(0);

            assertThatThrownBy(() -> vectorizationService.requestVectorization(documentId, true, false, "admin-1"))
                .isInstanceOf(InvalidDocumentStateException.class);
        }

        @Test
        @DisplayName("Should refuse summary mode for a document without a summary")
        void shouldRequireSummaryInSummaryMode() {
            when(documentRepository.findById(documentId)).thenReturn(Optional.of(Fixtures.document(documentId, null, false)));
            when(fileRepository.countByDocumentId(documentId)).thenReturn(1);

            assertThatThrownBy(() -> vectorizationService.requestVectorization(documentId, false, false, "admin-1"))
                .isInstanceOf(InvalidDocumentStateException.class)
                .hasMessageContaining("no summary");
        }
    }

    @Nested
    @DisplayName("Vector deletion requests")
    class DeleteVectors {

        @Test
        @DisplayName("Should enqueue a vector deletion and record who asked")
        void shouldEnqueueDeletion() {
            UUID taskId = UUID.randomUUID();
            when(documentRepository.findById(documentId)).thenReturn(Optional.of(Fixtures.document(documentId)));
            when(taskEnqueuer.enqueue(eq(TaskType.DELETE_VECTORS), anyMap())).thenReturn(taskId);

            assertThat(vectorizationService.requestVectorDeletion(documentId, "admin-1")).isEqualTo(taskId);
            verify(documentRepository).mergeMetadata(eq(documentId), argThat(metadata ->
                taskId.toString().equals(metadata.get(DocumentMetadataKeys.VECTOR_DELETE_TASK_ID))));
        }

        @Test
        @DisplayName("Should throw for an unknown document")
        void shouldThrowWhenMissing() {
            when(documentRepository.findById(documentId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> vectorizationService.requestVectorDeletion(documentId, "admin-1"))
                .isInstanceOf(DocumentNotFoundException.class);
        }
    }

    @Test
    @DisplayName("Should delegate the validity check to the chunk lifecycle")
    void shouldReconcile() {
        when(chunkLifecycle.reconcileExpired(any())).thenReturn(3);

        assertThat(vectorizationService.reconcileExpired()).isEqualTo(3);
    }
}
