package com.nevis.chat.model;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record ThreadMessage(
    UUID id,
    UUID threadId,
    String userId,
    MessageRole role,
    String content,
    String modelId,
    String provider,
    Map<String, Object> usage,
    Long costCents,
    OffsetDateTime createdAt
) {
    public static ThreadMessage userMessage(UUID threadId, String userId, String content) {
        return new ThreadMessage(null, threadId, userId, MessageRole.USER, content, null, null, null, null, null);
    }
}
