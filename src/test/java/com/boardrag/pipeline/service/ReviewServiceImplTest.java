package com.boardrag.pipeline.service;

import com.boardrag.pipeline.Fixtures;
import com.boardrag.pipeline.exception.DocumentNotFoundException;
import com.boardrag.pipeline.model.Document;
import com.boardrag.pipeline.model.DocumentMetadataKeys;
import com.boardrag.pipeline.model.DocumentStatus;
import com.boardrag.pipeline.repository.DocumentRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewServiceImplTest {

    @Mock
    private DocumentRepository documentRepository;

    @InjectMocks
    private ReviewServiceImpl reviewService;

    @Nested
    @DisplayName("Single document review")
    class Single {

        @Test
        @DisplayName("Should approve a pending document and record the reviewer")
        void shouldApprove() {
            UUID id = UUID.randomUUID();
            Document pending = Fixtures.document(id);
            when(documentRepository.findById(id))
                .thenReturn(Optional.of(pending), Optional.of(Fixtures.withStatus(pending, DocumentStatus.APPROVED)));

            Document approved = reviewService.approve(id, "admin-1");

            assertThat(approved.status()).isEqualTo(DocumentStatus.APPROVED);
            verify(documentRepository).updateStatus(eq(id), eq(DocumentStatus.APPROVED), argThat(metadata ->
                "admin-1".equals(metadata.get(DocumentMetadataKeys.APPROVED_BY))
                    && !metadata.containsKey(DocumentMetadataKeys.BATCH_APPROVAL)));
        }

        @Test
        @DisplayName("Should leave an approved document untouched")
        void shouldNotReapprove() {
            UUID id = UUID.randomUUID();
            when(documentRepository.findById(id))
                .thenReturn(Optional.of(Fixtures.withStatus(Fixtures.document(id), DocumentStatus.APPROVED)));

            reviewService.approve(id, "admin-1");

            verify(documentRepository, never()).updateStatus(any(), any(), anyMap());
        }

        @Test
        @DisplayName("Should send a rejected document back to pending with the reason")
        void shouldRejectToPending() {
            UUID id = UUID.randomUUID();
            Document approved = Fixtures.withStatus(Fixtures.document(id), DocumentStatus.APPROVED);
            when(documentRepository.findById(id)).thenReturn(Optional.of(approved));

            reviewService.reject(id, "Wrong year", "admin-1");

            verify(documentRepository).updateStatus(eq(id), eq(DocumentStatus.PENDING_APPROVAL), argThat(metadata ->
                "Wrong year".equals(metadata.get(DocumentMetadataKeys.REJECT_REASON))
                    && "admin-1".equals(metadata.get(DocumentMetadataKeys.REJECTED_BY))));
        }

        @Test
        @DisplayName("Should throw for an unknown document")
        void shouldThrowWhenMissing() {
            UUID id = UUID.randomUUID();
            when(documentRepository.findById(id)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> reviewService.approve(id, "admin-1")).isInstanceOf(DocumentNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Batch review")
    class Batch {

        @Test
        @DisplayName("Should approve found documents and report missing ones individually")
        void shouldApproveBatchWithPartialFailures() {
            UUID pending = UUID.randomUUID();
            UUID alreadyApproved = UUID.randomUUID();
            UUID missing = UUID.randomUUID();
            List<UUID> ids = List.of(pending, missing, alreadyApproved, pending);
            when(documentRepository.findAllById(ids)).thenReturn(List.of(
                Fixtures.document(pending),
                Fixtures.withStatus(Fixtures.document(alreadyApproved), DocumentStatus.APPROVED)));

            BatchResult result = reviewService.approveAll(ids, "admin-1");

            assertThat(result.succeeded()).containsExactly(pending, alreadyApproved);
            assertThat(result.failed()).containsExactly(new BatchResult.BatchFailure(missing, "Document not found"));
            verify(documentRepository, times(1)).updateStatus(eq(pending), eq(DocumentStatus.APPROVED),
                argThat(metadata -> Boolean.TRUE.equals(metadata.get(DocumentMetadataKeys.BATCH_APPROVAL))));
            verify(documentRepository, never()).updateStatus(eq(alreadyApproved), any(), anyMap());
        }

        @Test
        @DisplayName("Should reject every found document with the shared reason")
        void shouldRejectBatch() {
            UUID first = UUID.randomUUID();
            UUID second = UUID.randomUUID();
            List<UUID> ids = List.of(first, second);
            when(documentRepository.findAllById(ids)).thenReturn(List.of(Fixtures.document(first), Fixtures.document(second)));

            BatchResult result = reviewService.rejectAll(ids, "Duplicate", "admin-1");

            assertThat(result.succeeded()).containsExactly(first, second);
            assertThat(result.failed()).isEmpty();
            verify(documentRepository, times(2)).updateStatus(any(), eq(DocumentStatus.PENDING_APPROVAL), argThat(metadata ->
                "Duplicate".equals(metadata.get(DocumentMetadataKeys.REJECT_REASON))
                    && Boolean.TRUE.equals(metadata.get(DocumentMetadataKeys.BATCH_REJECTION))));
        }
    }
}
