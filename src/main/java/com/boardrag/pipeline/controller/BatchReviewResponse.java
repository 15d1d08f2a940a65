package com.boardrag.pipeline.controller;

import com.boardrag.pipeline.service.BatchResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

public record BatchReviewResponse(
    List<UUID> succeeded,

    List<Failure> failed
) {

    public record Failure(
        @JsonProperty("document_id")
        UUID documentId,

        String reason
    ) {}

    public static BatchReviewResponse from(BatchResult result) {
        return new BatchReviewResponse(
            result.succeeded(),
            result.failed().stream()
                .map(failure -> new Failure(failure.documentId(), failure.reason()))
                .toList()
        );
    }
}
