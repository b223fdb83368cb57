package com.nevis.chat.model;

public record Citation(
    int rank,
    String chunkId,
    String docId,
    String url,
    String title,
    String section,
    double score,
    String snippet,
    double multiplierApplied
) {}
