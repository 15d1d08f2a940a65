package com.boardrag.pipeline.service;

import java.util.UUID;

public interface VectorizationService {
    UUID requestVectorization(UUID documentId, boolean fullVectorize, boolean force, String adminId);
    UUID requestVectorDeletion(UUID documentId, String adminId);
    int reconcileExpired();
}
