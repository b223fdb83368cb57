package com.nevis.chat.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.chat.model.Citation;

public record CitationResponse(
    int index,
    @JsonProperty("chunk_id") String chunkId,
    @JsonProperty("doc_id") String docId,
    String title,
    String url,
    String section,
    double score,
    String snippet,
    @JsonProperty("multiplier_applied") double multiplierApplied
) {
    public static CitationResponse from(Citation citation) {
        return new CitationResponse(
            citation.rank(),
            citation.chunkId(),
            citation.docId(),
            citation.title(),
            citation.url(),
            citation.section(),
            citation.score(),
            citation.snippet(),
            citation.multiplierApplied()
        );
    }
}
