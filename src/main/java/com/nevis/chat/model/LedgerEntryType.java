package com.nevis.chat.model;

public enum LedgerEntryType {
    GRANT,
    RESERVE,
    DEBIT,
    RELEASE;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static LedgerEntryType fromDb(String value) {
        return valueOf(value.toUpperCase());
    }
}
