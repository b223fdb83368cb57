package com.nevis.chat.model;

import java.time.OffsetDateTime;

public record UserBalance(
    String userId,
    long balanceCents,
    long lifetimeGrantedCents,
    long lifetimeSpentCents,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {}
