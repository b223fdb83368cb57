package com.nevis.chat.model;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record LedgerEntry(
    UUID id,
    String userId,
    LedgerEntryType type,
    long amountCents,
    String requestId,
    UUID threadId,
    UUID messageId,
    String modelId,
    String provider,
    Map<String, Object> metadata,
    OffsetDateTime createdAt
) {}
