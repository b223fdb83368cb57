package com.nevis.chat.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.chat.exception.TurnException;
import com.nevis.chat.model.CredentialAuditEvent;
import com.nevis.chat.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Records every use of a stored personal API key. Identifiers that look like secrets are
 * redacted before they reach the log or the audit table.
 */
@Slf4j(topic = "credential-audit")
@Component
@RequiredArgsConstructor
public class CredentialAuditLogger {

    static final String TARGET_TYPE = "user_api_key";
    static final String REDACTED_TARGET = "redacted";
    static final String REDACTED_REASON = "redacted_reason";

    private static final Pattern SAFE_TOKEN = Pattern.compile("^[A-Za-z0-9._:-]{1,128}$");
    private static final Pattern SAFE_REASON_CODE = Pattern.compile("^[a-z0-9_.:-]{1,80}$");
    private static final Pattern SENSITIVE_FRAGMENT =
        Pattern.compile("(sk-[a-z0-9]|apikey|api[-_]?key|bearer|token|AIza)", Pattern.CASE_INSENSITIVE);
    // Reason codes are our own identifiers (invalid_user_api_key), so only secret-shaped prefixes are rejected.
    private static final Pattern SECRET_VALUE = Pattern.compile("(sk-[a-z0-9]|bearer|aiza)");

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    public void log(CredentialAuditEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("actorUserId", event.actorUserId());
        payload.put("action", event.action());
        payload.put("targetId", sanitizeToken(event.targetId(), REDACTED_TARGET));
        payload.put("provider", event.provider() == null ? null : event.provider().wireName());
        payload.put("result", event.result().wireName());
        payload.put("requestId", sanitizeToken(event.requestId(), null));
        payload.put("reasonCode", normalizeReasonCode(event.reasonCode()));
        payload.put("timestamp", Instant.now().toString());

        log.info("user_credential_audit {}", toJson(payload));

        try {
            auditLogRepository.save(event.actorUserId(), event.action(), TARGET_TYPE,
                (String) payload.get("targetId"), payload);
        } catch (DataAccessException e) {
            log.warn("Failed to persist credential audit event {} for {}: {}",
                event.action(), payload.get("targetId"), e.getMessage());
        }
    }

    /**
     * The machine code of a failure, used as the audit reason.
     */
    public static String reasonCodeOf(Throwable error) {
        if (error instanceof TurnException turnException && turnException.getCode() != null) {
            return turnException.getCode();
        }
        return "unexpected_error";
    }

    static String sanitizeToken(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String trimmed = value.trim();
        if (!SAFE_TOKEN.matcher(trimmed).matches() || SENSITIVE_FRAGMENT.matcher(trimmed).find()) {
            return fallback;
        }
        return trimmed;
    }

    static String normalizeReasonCode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (!SAFE_REASON_CODE.matcher(normalized).matches() || SECRET_VALUE.matcher(normalized).find()) {
            return REDACTED_REASON;
        }
        return normalized;
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return payload.toString();
        }
    }
}
