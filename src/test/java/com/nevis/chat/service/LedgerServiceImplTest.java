package com.nevis.chat.service;

import com.nevis.chat.exception.InsufficientBalanceException;
import com.nevis.chat.exception.InvalidTurnRequestException;
import com.nevis.chat.exception.SettlementException;
import com.nevis.chat.model.LedgerCorrelation;
import com.nevis.chat.model.LedgerEntryType;
import com.nevis.chat.model.SettlementOutcome;
import com.nevis.chat.model.UserBalance;
import com.nevis.chat.repository.BalanceRepository;
import com.nevis.chat.repository.LedgerRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerServiceImplTest {

    private static final String USER = "user-1";
    private static final LedgerCorrelation CORRELATION =
        new LedgerCorrelation("req-1", UUID.randomUUID(), null, "openai:gpt-5-mini", "openai", null);

    @Mock
    private BalanceRepository balanceRepository;

    @Mock
    private LedgerRepository ledgerRepository;

    @InjectMocks
    private LedgerServiceImpl ledgerService;

    @Captor
    private ArgumentCaptor<Map<String, Object>> metadata;

    @Nested
    @DisplayName("reserve")
    class Reserve {

        @Test
        void shouldDecrementAndRecordReserveEntry() {
            when(balanceRepository.reserveIfSufficient(USER, 40)).thenReturn(Optional.of(60L));

            long remaining = ledgerService.reserve(USER, 40, CORRELATION);

            assertThat(remaining).isEqualTo(60);
            verify(ledgerRepository).append(USER, LedgerEntryType.RESERVE, 40, CORRELATION, Map.of());
        }

        @Test
        void shouldRefuseWithCurrentBalanceAndWriteNothing() {
            when(balanceRepository.reserveIfSufficient(USER, 40)).thenReturn(Optional.empty());
            when(balanceRepository.findByUserId(USER)).thenReturn(Optional.of(new UserBalance(USER, 10, 10, 0, null, null)));

            assertThatThrownBy(() -> ledgerService.reserve(USER, 40, CORRELATION))
                .isInstanceOfSatisfying(InsufficientBalanceException.class, e -> {
                    assertThat(e.getRemainingBalanceCents()).isEqualTo(10);
                    assertThat(e.getRequestedCents()).isEqualTo(40);
                    assertThat(e.getCode()).isEqualTo("insufficient_balance");
                });
            verifyNoInteractions(ledgerRepository);
        }

        @Test
        void shouldReportZeroWhenUserHasNoBalanceRow() {
            when(balanceRepository.reserveIfSufficient(USER, 5)).thenReturn(Optional.empty());
            when(balanceRepository.findByUserId(USER)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> ledgerService.reserve(USER, 5, CORRELATION))
                .isInstanceOfSatisfying(InsufficientBalanceException.class,
                    e -> assertThat(e.getRemainingBalanceCents()).isZero());
        }

        @ParameterizedTest
        @ValueSource(longs = {0, -3})
        void shouldRejectNonPositiveAmounts(long amount) {
            assertThatThrownBy(() -> ledgerService.reserve(USER, amount, CORRELATION))
                .isInstanceOfSatisfying(InvalidTurnRequestException.class,
                    e -> assertThat(e.getCode()).isEqualTo("invalid_reservation"));
            verifyNoInteractions(balanceRepository, ledgerRepository);
        }
    }

    @Nested
    @DisplayName("finalizeReservation")
    class FinalizeReservation {

        @Test
        void shouldDebitActualAndReleaseRemainder() {
            when(balanceRepository.settle(USER, 15, 25)).thenReturn(75L);

            SettlementOutcome outcome = ledgerService.finalizeReservation(USER, 40, 25, CORRELATION);

            assertThat(outcome).isEqualTo(new SettlementOutcome(25, 15, 75));
            Map<String, Object> expected = Map.of("rawActualCostCents", 25L, "debitedCents", 25L);
            verify(ledgerRepository).append(USER, LedgerEntryType.DEBIT, 25, CORRELATION, expected);
            verify(ledgerRepository).append(USER, LedgerEntryType.RELEASE, 15, CORRELATION, expected);
        }

        @Test
        void shouldSkipDebitEntryWhenNothingWasSpent() {
            when(balanceRepository.settle(USER, 40, 0)).thenReturn(100L);

            SettlementOutcome outcome = ledgerService.finalizeReservation(USER, 40, 0, CORRELATION);

            assertThat(outcome).isEqualTo(new SettlementOutcome(0, 40, 100));
            verify(ledgerRepository, never()).append(anyString(), eq(LedgerEntryType.DEBIT), anyLong(), any(), anyMap());
            verify(ledgerRepository).append(eq(USER), eq(LedgerEntryType.RELEASE), eq(40L), eq(CORRELATION), anyMap());
        }

        @Test
        void shouldSkipReleaseEntryWhenEstimateWasExact() {
            when(balanceRepository.settle(USER, 0, 40)).thenReturn(60L);

            ledgerService.finalizeReservation(USER, 40, 40, CORRELATION);

            verify(ledgerRepository).append(eq(USER), eq(LedgerEntryType.DEBIT), eq(40L), eq(CORRELATION), anyMap());
            verify(ledgerRepository, never()).append(anyString(), eq(LedgerEntryType.RELEASE), anyLong(), any(), anyMap());
        }

        @Test
        void shouldRejectOverrunWithoutWriting() {
            assertThatThrownBy(() -> ledgerService.finalizeReservation(USER, 40, 41, CORRELATION))
                .isInstanceOfSatisfying(SettlementException.class, e -> {
                    assertThat(e.getReservedCents()).isEqualTo(40);
                    assertThat(e.getActualCostCents()).isEqualTo(41);
                    assertThat(e.getRequestId()).isEqualTo("req-1");
                    assertThat(e.getThreadId()).isEqualTo(CORRELATION.threadId());
                    assertThat(e.getMessage()).contains("req-1", CORRELATION.threadId().toString());
                });
            verifyNoInteractions(balanceRepository, ledgerRepository);
        }
    }

    @Nested
    @DisplayName("release")
    class Release {

        @Test
        void shouldReturnWholeReservationWithReason() {
            when(balanceRepository.settle(USER, 40, 0)).thenReturn(100L);

            long balance = ledgerService.release(USER, 40, CORRELATION, "provider_error", "provider_request_failed");

            assertThat(balance).isEqualTo(100);
            verify(ledgerRepository).append(eq(USER), eq(LedgerEntryType.RELEASE), eq(40L), eq(CORRELATION), metadata.capture());
            assertThat(metadata.getValue())
                .containsEntry("reason", "provider_error")
                .containsEntry("code", "provider_request_failed");
        }

        @Test
        void shouldBeNoOpForZeroReservation() {
            when(balanceRepository.findByUserId(USER)).thenReturn(Optional.of(new UserBalance(USER, 55, 55, 0, null, null)));

            assertThat(ledgerService.release(USER, 0, CORRELATION, "provider_error", null)).isEqualTo(55);
            verify(balanceRepository, never()).settle(anyString(), anyLong(), anyLong());
            verifyNoInteractions(ledgerRepository);
        }
    }

    @Nested
    @DisplayName("grant")
    class Grant {

        @Test
        void shouldCreditAndRecordActor() {
            when(balanceRepository.credit(USER, 500)).thenReturn(500L);

            assertThat(ledgerService.grant(USER, 500, "admin-1", " welcome credit ")).isEqualTo(500);

            verify(ledgerRepository).append(USER, LedgerEntryType.GRANT, 500, LedgerCorrelation.none(),
                Map.of("actorUserId", "admin-1", "reason", "welcome credit"));
        }

        @Test
        void shouldRejectNonPositiveGrant() {
            assertThatThrownBy(() -> ledgerService.grant(USER, 0, "admin-1", null))
                .isInstanceOfSatisfying(InvalidTurnRequestException.class,
                    e -> assertThat(e.getCode()).isEqualTo("invalid_credit_amount"));
        }
    }

    @Test
    void balanceOfDefaultsToZero() {
        when(balanceRepository.findByUserId(USER)).thenReturn(Optional.empty());

        assertThat(ledgerService.balanceOf(USER)).isZero();
        assertThat(ledgerService.balanceDetails(USER).balanceCents()).isZero();
    }
}
