package com.nevis.chat.model;

public record CostMetrics(
    double inputCostUsd,
    double outputCostUsd,
    double totalCostUsd,
    double inputRateUsdPerMillion,
    double outputRateUsdPerMillion,
    PricingTier pricingTier,
    boolean hasPricing
) {
    public static CostMetrics unpriced() {
        return new CostMetrics(0, 0, 0, 0, 0, PricingTier.UNKNOWN, false);
    }
}
