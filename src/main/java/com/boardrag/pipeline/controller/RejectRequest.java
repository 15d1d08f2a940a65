package com.boardrag.pipeline.controller;

import jakarta.validation.constraints.NotBlank;

public record RejectRequest(
    @NotBlank
    String reason
) {}
