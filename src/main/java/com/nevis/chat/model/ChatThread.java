package com.nevis.chat.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record ChatThread(
    UUID id,
    String title,
    ThreadVisibility visibility,
    String createdByUserId,
    List<String> participantIds,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {
    public static final String DEFAULT_TITLE = "New thread";

    public boolean isAccessibleBy(String userId) {
        if (visibility == ThreadVisibility.ORG) {
            return true;
        }
        return createdByUserId.equals(userId) || participantIds.contains(userId);
    }
}
