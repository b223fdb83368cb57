package com.nevis.chat.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Identifiers copied onto every ledger entry written for one turn.
 */
public record LedgerCorrelation(
    String requestId,
    UUID threadId,
    UUID messageId,
    String modelId,
    String provider,
    Map<String, Object> metadata
) {

    public LedgerCorrelation {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static LedgerCorrelation none() {
        return new LedgerCorrelation(null, null, null, null, null, Map.of());
    }

    public LedgerCorrelation withMessageId(UUID messageId) {
        return new LedgerCorrelation(requestId, threadId, messageId, modelId, provider, metadata);
    }

    public LedgerCorrelation withMetadata(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new LedgerCorrelation(requestId, threadId, messageId, modelId, provider, merged);
    }
}
