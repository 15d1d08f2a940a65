package com.boardrag.pipeline.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record VisibilityRequest(
    @NotNull
    @JsonProperty("is_public")
    Boolean isPublic
) {}
