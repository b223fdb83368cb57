package com.nevis.chat.model;

public enum PricingTier {
    STANDARD("standard"),
    LONG_CONTEXT("long-context"),
    UNKNOWN("unknown");

    private final String label;

    PricingTier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
