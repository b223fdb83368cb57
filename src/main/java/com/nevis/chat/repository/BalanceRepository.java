package com.nevis.chat.repository;

import com.nevis.chat.model.UserBalance;

import java.util.Optional;

public interface BalanceRepository {

    Optional<UserBalance> findByUserId(String userId);

    /**
     * Creates the balance row on first grant.
     *
     * @return the balance after the grant
     */
    long credit(String userId, long amountCents);

    /**
     * Decrements the balance only when it covers {@code amountCents}, as one conditional update.
     *
     * @return the remaining balance, or empty when the balance was insufficient or missing
     */
    Optional<Long> reserveIfSufficient(String userId, long amountCents);

    /**
     * Returns {@code releaseCents} to the balance and adds {@code spentCents} to the lifetime spend.
     *
     * @return the balance after settlement
     */
    long settle(String userId, long releaseCents, long spentCents);
}
