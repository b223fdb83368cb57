package com.nevis.chat.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.chat.model.AssistantReply;
import com.nevis.chat.model.BudgetSummary;
import com.nevis.chat.model.CostMetrics;
import com.nevis.chat.model.ThreadMessage;
import com.nevis.chat.model.TurnResult;
import com.nevis.chat.model.UsageMetrics;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record TurnResponse(
    @JsonProperty("thread_id") UUID threadId,
    @JsonProperty("user_message") UserMessage userMessage,
    Assistant assistant,
    Budget budget,
    Retrieval retrieval
) {

    public record UserMessage(UUID id, String content, @JsonProperty("created_at") OffsetDateTime createdAt) {}

    public record Usage(
        @JsonProperty("input_tokens") int inputTokens,
        @JsonProperty("output_tokens") int outputTokens,
        @JsonProperty("total_tokens") int totalTokens
    ) {
        static Usage from(UsageMetrics usage) {
            return new Usage(usage.inputTokens(), usage.outputTokens(), usage.totalTokens());
        }
    }

    public record Cost(
        @JsonProperty("total_cost_usd") double totalCostUsd,
        @JsonProperty("input_cost_usd") double inputCostUsd,
        @JsonProperty("output_cost_usd") double outputCostUsd,
        @JsonProperty("has_pricing") boolean hasPricing,
        @JsonProperty("pricing_tier") String pricingTier
    ) {
        static Cost from(CostMetrics cost) {
            return new Cost(cost.totalCostUsd(), cost.inputCostUsd(), cost.outputCostUsd(),
                cost.hasPricing(), cost.pricingTier().label());
        }
    }

    public record Assistant(
        UUID id,
        String role,
        String content,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        Usage usage,
        Cost cost,
        @JsonProperty("cost_cents") long costCents,
        @JsonProperty("model_id") String modelId,
        String provider,
        @JsonProperty("billing_mode") String billingMode,
        List<CitationResponse> citations
    ) {}

    public record Budget(
        @JsonProperty("reserved_cents") long reservedCents,
        @JsonProperty("charged_cents") long chargedCents,
        @JsonProperty("released_cents") long releasedCents,
        @JsonProperty("remaining_balance_cents") long remainingBalanceCents
    ) {}

    public record Retrieval(int count, @JsonProperty("top_k") int topK) {}

    public static TurnResponse from(TurnResult result) {
        ThreadMessage user = result.userMessage();
        AssistantReply reply = result.assistantMessage();
        BudgetSummary budget = result.budget();

        return new TurnResponse(
            result.threadId(),
            new UserMessage(user.id(), user.content(), user.createdAt()),
            new Assistant(
                reply.id(),
                "assistant",
                reply.content(),
                reply.createdAt(),
                Usage.from(reply.usage()),
                Cost.from(reply.cost()),
                reply.costCents(),
                reply.modelId(),
                reply.provider().wireName(),
                reply.billingMode().wireName(),
                reply.citations().stream().map(CitationResponse::from).toList()
            ),
            new Budget(budget.reservedCents(), budget.chargedCents(), budget.releasedCents(), budget.remainingBalanceCents()),
            new Retrieval(result.retrievalCount(), result.topK())
        );
    }
}
