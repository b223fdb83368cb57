package com.nevis.chat.repository;

import com.nevis.chat.model.UserBalance;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcBalanceRepository implements BalanceRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<UserBalance> balanceRowMapper = (rs, rowNum) -> new UserBalance(
        rs.getString("user_id"),
        rs.getLong("balance_cents"),
        rs.getLong("lifetime_granted_cents"),
        rs.getLong("lifetime_spent_cents"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public Optional<UserBalance> findByUserId(String userId) {
        return jdbcClient.sql("SELECT * FROM user_balances WHERE user_id = :userId")
            .param("userId", userId)
            .query(balanceRowMapper)
            .optional();
    }

    @Override
    public long credit(String userId, long amountCents) {
        return jdbcClient.sql("""
                INSERT INTO user_balances (user_id, balance_cents, lifetime_granted_cents)
                VALUES (:userId, :amount, :amount)
                ON CONFLICT (user_id) DO UPDATE
                SET balance_cents = user_balances.balance_cents + EXCLUDED.balance_cents,
                    lifetime_granted_cents = user_balances.lifetime_granted_cents + EXCLUDED.lifetime_granted_cents,
                    updated_at = NOW()
                RETURNING balance_cents
                """)
            .param("userId", userId)
            .param("amount", amountCents)
            .query(Long.class)
            .single();
    }

    @Override
    public Optional<Long> reserveIfSufficient(String userId, long amountCents) {
        return jdbcClient.sql("""
                UPDATE user_balances
                SET balance_cents = balance_cents - :amount,
                    updated_at = NOW()
                WHERE user_id = :userId
                  AND balance_cents >= :amount
                RETURNING balance_cents
                """)
            .param("userId", userId)
            .param("amount", amountCents)
            .query(Long.class)
            .optional();
    }

    @Override
    public long settle(String userId, long releaseCents, long spentCents) {
        return jdbcClient.sql("""
                UPDATE user_balances
                SET balance_cents = balance_cents + :release,
                    lifetime_spent_cents = lifetime_spent_cents + :spent,
                    updated_at = NOW()
                WHERE user_id = :userId
                RETURNING balance_cents
                """)
            .param("userId", userId)
            .param("release", releaseCents)
            .param("spent", spentCents)
            .query(Long.class)
            .optional()
            .orElseThrow(() -> new IllegalStateException("No balance row for user " + userId + " while settling a reservation"));
    }
}
