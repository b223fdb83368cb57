package com.nevis.chat.model;

import java.util.List;

public record RetrievalResult(
    Passage passage,
    double score,
    List<String> matchedTerms,
    String snippet,
    double multiplierApplied
) {}
