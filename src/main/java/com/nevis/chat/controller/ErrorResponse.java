package com.nevis.chat.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String error,
    String code,
    int status,
    long timestamp,
    @JsonProperty("remaining_balance_cents") Long remainingBalanceCents
) {
    public ErrorResponse(String error, String code, int status, long timestamp) {
        this(error, code, status, timestamp, null);
    }
}
