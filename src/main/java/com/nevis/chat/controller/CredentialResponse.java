package com.nevis.chat.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.chat.model.UserCredential;

import java.time.OffsetDateTime;
import java.util.UUID;

public record CredentialResponse(
    UUID id,
    String provider,
    String label,
    @JsonProperty("key_preview") String keyPreview,
    @JsonProperty("created_at") OffsetDateTime createdAt
) {
    public static CredentialResponse from(UserCredential credential) {
        return new CredentialResponse(
            credential.id(),
            credential.provider().wireName(),
            credential.label(),
            credential.keyPreview(),
            credential.createdAt()
        );
    }
}
