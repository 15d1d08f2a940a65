package com.boardrag.pipeline.controller;

import com.boardrag.pipeline.model.Document;
import com.boardrag.pipeline.model.DocumentStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record DocumentResponse(
    UUID id,

    @JsonProperty("owner_id")
    String ownerId,

    String title,

    String summary,

    List<String> tags,

    DocumentStatus status,

    @JsonProperty("is_public")
    boolean isPublic,

    @JsonProperty("start_date")
    OffsetDateTime startDate,

    @JsonProperty("end_date")
    OffsetDateTime endDate,

    @JsonProperty("view_count")
    int viewCount,

    @JsonProperty("download_count")
    int downloadCount,

    boolean vectorized,

    Map<String, Object> metadata,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt
) {

    public static DocumentResponse from(Document doc) {
        return new DocumentResponse(
            doc.id(),
            doc.ownerId(),
            doc.title(),
            doc.summary(),
            doc.tags(),
            doc.status(),
            doc.isPublic(),
            doc.startDate(),
            doc.endDate(),
            doc.viewCount(),
            doc.downloadCount(),
            doc.vectorized(),
            doc.metadata(),
            doc.createdAt(),
            doc.updatedAt()
        );
    }
}
