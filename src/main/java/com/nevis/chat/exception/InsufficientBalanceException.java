package com.nevis.chat.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class InsufficientBalanceException extends TurnException {
    private final String userId;
    private final long requestedCents;
    private final long remainingBalanceCents;

    public InsufficientBalanceException(String userId, long requestedCents, long remainingBalanceCents) {
        super("Insufficient balance: requested " + requestedCents + " cents, remaining " + remainingBalanceCents + " cents",
            "insufficient_balance", HttpStatus.PAYMENT_REQUIRED);
        this.userId = userId;
        this.requestedCents = requestedCents;
        this.remainingBalanceCents = remainingBalanceCents;
    }
}
