package com.nevis.chat.repository;

public record RetrievalSignal(
    String chunkId,
    double multiplier,
    double avgRating,
    int ratingCount,
    int lowCount,
    int highCount
) {}
