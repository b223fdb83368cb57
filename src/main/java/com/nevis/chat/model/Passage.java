package com.nevis.chat.model;

import java.util.List;

public record Passage(
    String chunkId,
    String docId,
    String url,
    String title,
    String section,
    List<String> headingPath,
    String text,
    String source,
    String sourceHost
) {}
