package com.nevis.chat.model;

public record ProviderResponse(
    String modelId,
    ProviderId provider,
    String apiModel,
    String text,
    UsageMetrics usage
) {}
