package com.boardrag.pipeline.service;

import java.time.OffsetDateTime;
import java.util.List;

public record CreateDocumentCommand(
    String ownerId,
    String title,
    String summary,
    List<String> tags,
    boolean isPublic,
    OffsetDateTime startDate,
    OffsetDateTime endDate
) {}
