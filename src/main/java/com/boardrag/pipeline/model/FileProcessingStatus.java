package com.boardrag.pipeline.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Processing state of a stored file. Legal moves are
 * {@code PENDING -> PROCESSING -> COMPLETED | FAILED} and {@code FAILED -> PROCESSING}.
 */
public enum FileProcessingStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean canTransitionTo(FileProcessingStatus target) {
        return switch (this) {
            case PENDING -> target == PROCESSING;
            case PROCESSING -> target == COMPLETED || target == FAILED;
            case FAILED -> target == PROCESSING;
            case COMPLETED -> false;
        };
    }

    public static Set<FileProcessingStatus> predecessorsOf(FileProcessingStatus target) {
        return Arrays.stream(values())
            .filter(status -> status.canTransitionTo(target))
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(FileProcessingStatus.class)));
    }
}
