package com.boardrag.pipeline.controller;

import com.boardrag.pipeline.service.AdminStatsService;
import com.boardrag.pipeline.service.ReviewService;
import com.boardrag.pipeline.service.VectorizationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

import static com.boardrag.pipeline.controller.DocumentController.USER_HEADER;

@RestController
@RequestMapping("/admin/documents")
@RequiredArgsConstructor
public class AdminDocumentController {

    private final ReviewService reviewService;
    private final VectorizationService vectorizationService;
    private final AdminStatsService statsService;

    @PostMapping("/{id}/approve")
    public ResponseEntity<DocumentResponse> approve(@RequestHeader(USER_HEADER) String adminId, @PathVariable UUID id) {
        return ResponseEntity.ok(DocumentResponse.from(reviewService.approve(id, adminId)));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<DocumentResponse> reject(
        @RequestHeader(USER_HEADER) String adminId,
        @PathVariable UUID id,
        @Valid @RequestBody RejectRequest request) {

        return ResponseEntity.ok(DocumentResponse.from(reviewService.reject(id, request.reason(), adminId)));
    }

    @PostMapping("/batch/approve")
    public ResponseEntity<BatchReviewResponse> approveBatch(
        @RequestHeader(USER_HEADER) String adminId,
        @Valid @RequestBody BatchReviewRequest request) {

        return ResponseEntity.ok(BatchReviewResponse.from(reviewService.approveAll(request.documentIds(), adminId)));
    }

    @PostMapping("/batch/reject")
    public ResponseEntity<BatchReviewResponse> rejectBatch(
        @RequestHeader(USER_HEADER) String adminId,
        @Valid @RequestBody BatchReviewRequest request) {

        if (!StringUtils.hasText(request.reason())) {
            throw new IllegalArgumentException("A reason is required to reject documents");
        }
        return ResponseEntity.ok(BatchReviewResponse.from(
            reviewService.rejectAll(request.documentIds(), request.reason(), adminId)));
    }

    @PostMapping("/{id}/vectorize")
    public ResponseEntity<TaskAcceptedResponse> vectorize(
        @RequestHeader(USER_HEADER) String adminId,
        @PathVariable UUID id,
        @RequestParam(name = "full", defaultValue = "false") boolean full,
        @RequestParam(name = "force", defaultValue = "false") boolean force) {

        UUID taskId = vectorizationService.requestVectorization(id, full, force, adminId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new TaskAcceptedResponse(taskId, id));
    }

    @DeleteMapping("/{id}/vectors")
    public ResponseEntity<TaskAcceptedResponse> deleteVectors(@RequestHeader(USER_HEADER) String adminId, @PathVariable UUID id) {
        UUID taskId = vectorizationService.requestVectorDeletion(id, adminId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new TaskAcceptedResponse(taskId, id));
    }

    @PostMapping("/check-validity")
    public ResponseEntity<Map<String, Integer>> checkValidity() {
        return ResponseEntity.ok(Map.of("updated_documents", vectorizationService.reconcileExpired()));
    }

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> stats() {
        return ResponseEntity.ok(StatsResponse.from(statsService.collect()));
    }
}
