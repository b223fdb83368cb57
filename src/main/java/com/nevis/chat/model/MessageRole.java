package com.nevis.chat.model;

public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static MessageRole fromDb(String value) {
        return valueOf(value.toUpperCase());
    }
}
