package com.nevis.chat.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record GrantRequest(
    @NotNull @Positive @JsonProperty("amount_cents") Long amountCents,
    @Size(max = 200) String reason
) {}
