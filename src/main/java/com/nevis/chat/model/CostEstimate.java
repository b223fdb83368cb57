package com.nevis.chat.model;

public record CostEstimate(
    int inputTokensEstimate,
    int outputTokensEstimate,
    double estimatedCostUsd,
    long estimatedCostCents,
    PricingTier pricingTier
) {}
