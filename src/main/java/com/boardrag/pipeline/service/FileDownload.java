package com.boardrag.pipeline.service;

import com.boardrag.pipeline.infra.ObjectStream;
import com.boardrag.pipeline.model.DocumentFile;

/**
 * An open download. The caller owns {@code stream} and must close it.
 */
public record FileDownload(
    DocumentFile file,
    ObjectStream stream
) {}
