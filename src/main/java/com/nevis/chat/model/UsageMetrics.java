package com.nevis.chat.model;

public record UsageMetrics(int inputTokens, int outputTokens, int totalTokens) {}
