package com.boardrag.pipeline.exception;

import com.boardrag.pipeline.model.FileProcessingStatus;
import lombok.Getter;

import java.util.UUID;

@Getter
public class IllegalStatusTransitionException extends RuntimeException {
    private final UUID fileId;
    private final FileProcessingStatus from;
    private final FileProcessingStatus to;

    public IllegalStatusTransitionException(UUID fileId, FileProcessingStatus from, FileProcessingStatus to) {
        super("File " + fileId + " cannot move from " + from + " to " + to);
        this.fileId = fileId;
        this.from = from;
        this.to = to;
    }
}
