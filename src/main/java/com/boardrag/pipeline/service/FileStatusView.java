package com.boardrag.pipeline.service;

import com.boardrag.pipeline.model.DocumentFile;

public record FileStatusView(
    DocumentFile file,
    boolean existsInStorage
) {}
