package com.nevis.chat.service;

import lombok.Getter;

/**
 * Carries a failure out of the execute stage together with the amount it had reserved,
 * so the orchestrator can return exactly that amount.
 */
@Getter
class TurnExecutionFailure extends RuntimeException {

    private final long reservedCents;
    private final RuntimeException failure;

    TurnExecutionFailure(long reservedCents, RuntimeException failure) {
        super(failure.getMessage(), failure, false, false);
        this.reservedCents = reservedCents;
        this.failure = failure;
    }
}
