package com.nevis.chat.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CredentialRequest(
    @NotBlank String provider,
    @Size(max = 80) String label,
    @NotBlank @Size(max = 512) @JsonProperty("api_key") String apiKey
) {
    @Override
    public String toString() {
        return "CredentialRequest[provider=" + provider + ", label=" + label + "]";
    }
}
