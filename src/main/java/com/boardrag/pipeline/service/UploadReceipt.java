package com.boardrag.pipeline.service;

public record UploadReceipt(
    String storageKey,
    long size,
    String contentType,
    int uploadAttempts,
    int validationAttempts
) {}
