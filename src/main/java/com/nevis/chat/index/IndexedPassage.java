package com.nevis.chat.index;

import com.nevis.chat.model.Passage;

import java.util.Map;
import java.util.Set;

public record IndexedPassage(
    Passage passage,
    String cleanedText,
    String searchableTitle,
    String searchableText,
    Map<String, Integer> termFreq,
    int docLength,
    Set<String> titleTerms
) {
    public int termFrequency(String term) {
        return termFreq.getOrDefault(term, 0);
    }
}
