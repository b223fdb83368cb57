package com.nevis.chat.model;

import java.util.UUID;

public record TurnResult(
    UUID threadId,
    ThreadMessage userMessage,
    AssistantReply assistantMessage,
    BudgetSummary budget,
    int retrievalCount,
    int topK
) {}
