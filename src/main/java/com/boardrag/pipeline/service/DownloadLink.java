package com.boardrag.pipeline.service;

import java.time.Instant;
import java.util.UUID;

public record DownloadLink(
    UUID fileId,
    String filename,
    String url,
    Instant expiresAt
) {}
