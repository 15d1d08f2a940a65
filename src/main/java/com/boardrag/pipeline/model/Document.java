package com.boardrag.pipeline.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record Document(
    UUID id,
    String ownerId,
    String title,
    String summary,
    List<String> tags,
    DocumentStatus status,
    boolean isPublic,
    OffsetDateTime startDate,
    OffsetDateTime endDate,
    int viewCount,
    int downloadCount,
    boolean vectorized,
    Map<String, Object> metadata,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {

    public static Document newDocument(String ownerId, String title, String summary, List<String> tags,
                                       boolean isPublic, OffsetDateTime startDate, OffsetDateTime endDate) {
        return new Document(null, ownerId, title, summary, tags == null ? List.of() : List.copyOf(tags),
            DocumentStatus.PENDING_APPROVAL, isPublic, startDate, endDate, 0, 0, false, Map.of(), null, null);
    }

    /**
     * A missing bound leaves that side of the window open.
     */
    public boolean isValidAt(OffsetDateTime now) {
        if (startDate != null && startDate.isAfter(now)) {
            return false;
        }
        return endDate == null || !endDate.isBefore(now);
    }

    public boolean hasSummary() {
        return summary != null && !summary.isBlank();
    }
}
