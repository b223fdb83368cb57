package com.nevis.chat.model;

import java.util.List;

public record TurnExecution(
    ProviderResponse response,
    CostMetrics measuredCost,
    long actualCostCents,
    long reservedCents,
    CostEstimate estimate,
    List<RetrievalResult> retrieval,
    String systemPrompt,
    List<ConversationMessage> trimmedMessages
) {}
