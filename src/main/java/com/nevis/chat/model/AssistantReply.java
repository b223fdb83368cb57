package com.nevis.chat.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record AssistantReply(
    UUID id,
    String content,
    String modelId,
    ProviderId provider,
    UsageMetrics usage,
    CostMetrics cost,
    long costCents,
    BillingMode billingMode,
    List<Citation> citations,
    OffsetDateTime createdAt
) {}
