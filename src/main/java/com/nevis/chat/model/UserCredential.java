package com.nevis.chat.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record UserCredential(
    UUID id,
    String userId,
    ProviderId provider,
    String label,
    String keyPreview,
    String encryptedKey,
    OffsetDateTime createdAt
) {
    @Override
    public String toString() {
        return "UserCredential[id=" + id + ", userId=" + userId + ", provider=" + provider + ", keyPreview=" + keyPreview + "]";
    }
}
