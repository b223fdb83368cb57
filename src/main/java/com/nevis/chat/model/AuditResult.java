package com.nevis.chat.model;

public enum AuditResult {
    SUCCESS,
    FAILURE;

    public String wireName() {
        return name().toLowerCase();
    }
}
