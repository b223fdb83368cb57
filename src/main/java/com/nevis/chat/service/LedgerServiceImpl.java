package com.nevis.chat.service;

import com.nevis.chat.exception.InsufficientBalanceException;
import com.nevis.chat.exception.InvalidTurnRequestException;
import com.nevis.chat.exception.SettlementException;
import com.nevis.chat.model.LedgerCorrelation;
import com.nevis.chat.model.LedgerEntry;
import com.nevis.chat.model.LedgerEntryType;
import com.nevis.chat.model.SettlementOutcome;
import com.nevis.chat.model.UserBalance;
import com.nevis.chat.repository.BalanceRepository;
import com.nevis.chat.repository.LedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerServiceImpl implements LedgerService {

    private final BalanceRepository balanceRepository;
    private final LedgerRepository ledgerRepository;

    @Override
    @Transactional
    public long grant(String userId, long amountCents, String actorUserId, String reason) {
        if (amountCents <= 0) {
            throw new InvalidTurnRequestException("Credit amount must be a positive number of cents.", "invalid_credit_amount");
        }

        long balance = balanceRepository.credit(userId, amountCents);

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (actorUserId != null) {
            metadata.put("actorUserId", actorUserId);
        }
        if (reason != null && !reason.isBlank()) {
            metadata.put("reason", reason.trim());
        }
        ledgerRepository.append(userId, LedgerEntryType.GRANT, amountCents, LedgerCorrelation.none(), metadata);

        log.info("Granted {} cents to user {} (balance now {})", amountCents, userId, balance);
        return balance;
    }

    @Override
    @Transactional
    public long reserve(String userId, long amountCents, LedgerCorrelation correlation) {
        if (amountCents <= 0) {
            throw new InvalidTurnRequestException("Reservation amount must be a positive number of cents.", "invalid_reservation");
        }

        Long remaining = balanceRepository.reserveIfSufficient(userId, amountCents).orElse(null);
        if (remaining == null) {
            long current = balanceOf(userId);
            log.debug("Reservation of {} cents refused for user {} (balance {})", amountCents, userId, current);
            throw new InsufficientBalanceException(userId, amountCents, current);
        }

        ledgerRepository.append(userId, LedgerEntryType.RESERVE, amountCents, correlation, Map.of());
        log.debug("Reserved {} cents for user {} request {} (remaining {})",
            amountCents, userId, correlation.requestId(), remaining);
        return remaining;
    }

    @Override
    @Transactional
    public SettlementOutcome finalizeReservation(String userId, long reservedCents, long actualCostCents,
                                                 LedgerCorrelation correlation) {
        long reserved = Math.max(0, reservedCents);
        long actual = Math.max(0, actualCostCents);
        if (actual > reserved) {
            LedgerCorrelation held = correlation == null ? LedgerCorrelation.none() : correlation;
            throw new SettlementException(userId, reserved, actual, held.requestId(), held.threadId());
        }

        long released = reserved - actual;
        long remaining = balanceRepository.settle(userId, released, actual);

        Map<String, Object> metadata = Map.of(
            "rawActualCostCents", actualCostCents,
            "debitedCents", actual
        );
        if (actual > 0) {
            ledgerRepository.append(userId, LedgerEntryType.DEBIT, actual, correlation, metadata);
        }
        if (released > 0) {
            ledgerRepository.append(userId, LedgerEntryType.RELEASE, released, correlation, metadata);
        }

        log.info("Settled request {} for user {}: reserved={} debited={} released={} balance={}",
            correlation.requestId(), userId, reserved, actual, released, remaining);
        return new SettlementOutcome(actual, released, remaining);
    }

    @Override
    @Transactional
    public long release(String userId, long reservedCents, LedgerCorrelation correlation, String reason, String code) {
        if (reservedCents <= 0) {
            return balanceOf(userId);
        }

        long remaining = balanceRepository.settle(userId, reservedCents, 0);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reason", reason);
        if (code != null) {
            metadata.put("code", code);
        }
        ledgerRepository.append(userId, LedgerEntryType.RELEASE, reservedCents, correlation, metadata);

        log.info("Released {} cents for user {} request {} ({})", reservedCents, userId, correlation.requestId(), reason);
        return remaining;
    }

    @Override
    @Transactional(readOnly = true)
    public long balanceOf(String userId) {
        return balanceRepository.findByUserId(userId)
            .map(UserBalance::balanceCents)
            .orElse(0L);
    }

    @Override
    @Transactional(readOnly = true)
    public UserBalance balanceDetails(String userId) {
        return balanceRepository.findByUserId(userId)
            .orElseGet(() -> new UserBalance(userId, 0, 0, 0, null, null));
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerEntry> entriesForRequest(String requestId) {
        return ledgerRepository.findByRequestId(requestId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerEntry> entriesForUser(String userId, int limit) {
        return ledgerRepository.findByUserId(userId, Math.max(1, Math.min(limit, 500)));
    }
}
