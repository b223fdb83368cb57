package com.nevis.chat.repository;

import com.nevis.chat.model.LedgerCorrelation;
import com.nevis.chat.model.LedgerEntry;
import com.nevis.chat.model.LedgerEntryType;

import java.util.List;
import java.util.Map;

/**
 * Append-only store of balance events. Entries are never updated or deleted.
 */
public interface LedgerRepository {

    LedgerEntry append(String userId, LedgerEntryType type, long amountCents,
                       LedgerCorrelation correlation, Map<String, Object> metadata);

    List<LedgerEntry> findByRequestId(String requestId);

    List<LedgerEntry> findByUserId(String userId, int limit);
}
