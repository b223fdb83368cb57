package com.nevis.chat.model;

import java.util.Arrays;
import java.util.Optional;

public enum ProviderId {
    OPENAI,
    ANTHROPIC,
    GEMINI;

    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<ProviderId> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
            .filter(p -> p.wireName().equals(normalized))
            .findFirst();
    }
}
