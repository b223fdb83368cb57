package com.nevis.chat.model;

public enum BillingMode {
    HOUSE_KEY,
    PERSONAL_KEY;

    public String wireName() {
        return name().toLowerCase();
    }
}
