package com.nevis.chat.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.chat.index.SourceStats;

import java.time.Instant;
import java.util.Map;

public record IndexDiagnostics(
    boolean built,
    @JsonProperty("build_count") int buildCount,
    @JsonProperty("last_build_ms") Long lastBuildMs,
    @JsonProperty("built_at") Instant builtAt,
    @JsonProperty("passage_count") int passageCount,
    @JsonProperty("document_count") int documentCount,
    @JsonProperty("corpus_path") String corpusPath,
    @JsonProperty("per_source") Map<String, SourceStats> perSource
) {}
