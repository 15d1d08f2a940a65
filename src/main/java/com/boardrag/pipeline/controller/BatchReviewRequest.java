package com.boardrag.pipeline.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.UUID;

/**
 * {@code reason} is required for batch rejection and ignored for approval.
 */
public record BatchReviewRequest(
    @NotEmpty
    @JsonProperty("document_ids")
    List<UUID> documentIds,

    String reason
) {}
