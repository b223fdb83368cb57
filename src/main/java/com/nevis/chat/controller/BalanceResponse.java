package com.nevis.chat.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.chat.model.UserBalance;

public record BalanceResponse(
    @JsonProperty("user_id") String userId,
    @JsonProperty("balance_cents") long balanceCents,
    @JsonProperty("lifetime_granted_cents") long lifetimeGrantedCents,
    @JsonProperty("lifetime_spent_cents") long lifetimeSpentCents
) {
    public static BalanceResponse from(UserBalance balance) {
        return new BalanceResponse(
            balance.userId(),
            balance.balanceCents(),
            balance.lifetimeGrantedCents(),
            balance.lifetimeSpentCents()
        );
    }
}
