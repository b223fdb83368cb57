package com.nevis.chat.model;

public record BudgetSummary(
    long reservedCents,
    long chargedCents,
    long releasedCents,
    long remainingBalanceCents
) {}
