package com.boardrag.pipeline.controller;

import com.boardrag.pipeline.service.DownloadLink;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record DownloadUrlResponse(
    @JsonProperty("file_id")
    UUID fileId,

    String filename,

    String url,

    @JsonProperty("expires_at")
    Instant expiresAt
) {

    public static DownloadUrlResponse from(DownloadLink link) {
        return new DownloadUrlResponse(link.fileId(), link.filename(), link.url(), link.expiresAt());
    }
}
