package com.nevis.chat.model;

public record CredentialAuditEvent(
    String actorUserId,
    String action,
    String targetId,
    ProviderId provider,
    AuditResult result,
    String requestId,
    String reasonCode
) {
    public static final String USE_ACTION = "user_api_key.use";
}
