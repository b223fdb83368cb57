package com.nevis.chat.model;

public record SettlementOutcome(
    long debitedCents,
    long releasedCents,
    long remainingBalanceCents
) {}
