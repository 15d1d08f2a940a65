package com.boardrag.pipeline.infra;

import java.util.List;

public record DeleteResult(boolean allDeleted, List<String> failedKeys) {

    public static DeleteResult success() {
        return new DeleteResult(true, List.of());
    }
}
