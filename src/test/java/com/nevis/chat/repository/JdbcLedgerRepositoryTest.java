package com.nevis.chat.repository;

import com.nevis.chat.model.LedgerCorrelation;
import com.nevis.chat.model.LedgerEntry;
import com.nevis.chat.model.LedgerEntryType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcLedgerRepositoryTest extends BaseIntegrationTest {

    @Autowired
    private LedgerRepository ledgerRepository;

    @Test
    @DisplayName("append should store correlation ids and merged metadata")
    void append_ShouldPersistCorrelation() {
        String userId = "user-" + UUID.randomUUID();
        String requestId = UUID.randomUUID().toString();
        UUID threadId = UUID.randomUUID();
        LedgerCorrelation correlation = new LedgerCorrelation(requestId, threadId, null, "openai:gpt-5", "openai",
            Map.of("pricingTier", "standard"));

        LedgerEntry reserve = ledgerRepository.append(userId, LedgerEntryType.RESERVE, 6, correlation, Map.of());
        ledgerRepository.append(userId, LedgerEntryType.DEBIT, 2, correlation, Map.of("debitedCents", 2));
        ledgerRepository.append(userId, LedgerEntryType.RELEASE, 4, correlation, Map.of("debitedCents", 2));

        assertThat(reserve.id()).isNotNull();
        assertThat(reserve.threadId()).isEqualTo(threadId);
        assertThat(reserve.metadata()).containsEntry("pricingTier", "standard");

        List<LedgerEntry> entries = ledgerRepository.findByRequestId(requestId);
        assertThat(entries).extracting(LedgerEntry::type)
            .containsExactly(LedgerEntryType.RESERVE, LedgerEntryType.DEBIT, LedgerEntryType.RELEASE);
        assertThat(entries.get(1).metadata())
            .containsEntry("pricingTier", "standard")
            .containsEntry("debitedCents", 2);
    }

    @Test
    @DisplayName("append should accept entries without correlation")
    void append_ShouldAllowEmptyCorrelation() {
        String userId = "user-" + UUID.randomUUID();

        LedgerEntry grant = ledgerRepository.append(userId, LedgerEntryType.GRANT, 100, LedgerCorrelation.none(), null);

        assertThat(grant.requestId()).isNull();
        assertThat(grant.metadata()).isEmpty();
        assertThat(ledgerRepository.findByUserId(userId, 10)).hasSize(1);
    }
}
