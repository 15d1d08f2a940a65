package com.boardrag.pipeline.model;

public enum DocumentStatus {
    PENDING_APPROVAL,
    APPROVED
}
