package com.boardrag.pipeline.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record TaskAcceptedResponse(
    @JsonProperty("task_id")
    UUID taskId,

    @JsonProperty("document_id")
    UUID documentId
) {}
