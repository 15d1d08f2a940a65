package com.boardrag.pipeline.service;

import com.boardrag.pipeline.model.Document;

import java.util.List;
import java.util.UUID;

public interface ReviewService {
    Document approve(UUID documentId, String adminId);
    Document reject(UUID documentId, String reason, String adminId);
    BatchResult approveAll(List<UUID> documentIds, String adminId);
    BatchResult rejectAll(List<UUID> documentIds, String reason, String adminId);
}
