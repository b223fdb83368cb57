package com.nevis.chat.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public record TurnRequest(
    @NotBlank @Size(max = 20_000) String content,
    @Size(max = 20) List<String> sources,
    @JsonProperty("model_id") String modelId,
    @JsonProperty("top_k") Double topK,
    Double temperature,
    @JsonProperty("max_output_tokens") Double maxOutputTokens,
    @JsonProperty("user_api_key_id") UUID userApiKeyId
) {}
