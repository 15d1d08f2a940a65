package com.boardrag.pipeline.model;

public enum TaskType {
    UPLOAD_FILE,
    VECTORIZE_DOCUMENT,
    DELETE_VECTORS
}
