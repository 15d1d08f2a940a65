package com.boardrag.pipeline.exception;

import lombok.Getter;

@Getter
public class UnsupportedFileTypeException extends RuntimeException {
    private final String fileType;

    public UnsupportedFileTypeException(String fileType) {
        super("Unsupported file type: " + fileType);
        this.fileType = fileType;
    }
}
