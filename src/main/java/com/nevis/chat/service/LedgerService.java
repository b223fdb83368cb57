package com.nevis.chat.service;

import com.nevis.chat.model.LedgerCorrelation;
import com.nevis.chat.model.LedgerEntry;
import com.nevis.chat.model.SettlementOutcome;
import com.nevis.chat.model.UserBalance;

import java.util.List;

/**
 * Prepaid balance operations. Every operation runs in its own transaction and appends
 * ledger entries; entries are never updated or deleted.
 */
public interface LedgerService {

    /**
     * Credits {@code amountCents}, creating the balance on first grant.
     *
     * @return the balance after the grant
     */
    long grant(String userId, long amountCents, String actorUserId, String reason);

    /**
     * Holds {@code amountCents} against the balance using a single conditional decrement.
     *
     * @return the remaining balance
     * @throws com.nevis.chat.exception.InsufficientBalanceException when the balance does not cover the amount
     */
    long reserve(String userId, long amountCents, LedgerCorrelation correlation);

    /**
     * Settles a reservation against the measured cost, debiting {@code actualCostCents} and
     * returning the rest of the hold.
     *
     * @throws com.nevis.chat.exception.SettlementException when the actual cost exceeds the reservation
     */
    SettlementOutcome finalizeReservation(String userId, long reservedCents, long actualCostCents,
                                          LedgerCorrelation correlation);

    /**
     * Returns a whole reservation to the balance after a failed turn.
     *
     * @return the balance after the release
     */
    long release(String userId, long reservedCents, LedgerCorrelation correlation, String reason, String code);

    long balanceOf(String userId);

    UserBalance balanceDetails(String userId);

    List<LedgerEntry> entriesForRequest(String requestId);

    List<LedgerEntry> entriesForUser(String userId, int limit);
}
