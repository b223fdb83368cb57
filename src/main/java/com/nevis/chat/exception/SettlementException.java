package com.nevis.chat.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Measured cost exceeded the reservation taken for it. Nothing is written when this is thrown,
 * so the reservation stays held until someone settles it by hand using the request id.
 */
@Getter
public class SettlementException extends TurnException {
    private final String userId;
    private final long reservedCents;
    private final long actualCostCents;
    private final String requestId;
    private final UUID threadId;

    public SettlementException(String userId, long reservedCents, long actualCostCents, String requestId, UUID threadId) {
        super("Settlement overrun for request " + requestId + " (thread " + threadId + ", user " + userId
                + "): actual " + actualCostCents + " cents exceeds reserved " + reservedCents,
            "settlement_overrun", HttpStatus.INTERNAL_SERVER_ERROR);
        this.userId = userId;
        this.reservedCents = reservedCents;
        this.actualCostCents = actualCostCents;
        this.requestId = requestId;
        this.threadId = threadId;
    }
}
