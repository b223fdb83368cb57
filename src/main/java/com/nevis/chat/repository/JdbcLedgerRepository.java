package com.nevis.chat.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.chat.model.LedgerCorrelation;
import com.nevis.chat.model.LedgerEntry;
import com.nevis.chat.model.LedgerEntryType;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcLedgerRepository implements LedgerRepository {

    private static final TypeReference<Map<String, Object>> JSON_MAP = new TypeReference<>() {};

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    private final RowMapper<LedgerEntry> entryRowMapper = (rs, rowNum) -> new LedgerEntry(
        rs.getObject("id", UUID.class),
        rs.getString("user_id"),
        LedgerEntryType.fromDb(rs.getString("type")),
        rs.getLong("amount_cents"),
        rs.getString("request_id"),
        rs.getObject("thread_id", UUID.class),
        rs.getObject("message_id", UUID.class),
        rs.getString("model_id"),
        rs.getString("provider"),
        readJson(rs.getString("metadata")),
        rs.getObject("created_at", OffsetDateTime.class)
    );

    @Override
    public LedgerEntry append(String userId, LedgerEntryType type, long amountCents,
                              LedgerCorrelation correlation, Map<String, Object> metadata) {
        Map<String, Object> merged = new LinkedHashMap<>(correlation.metadata());
        if (metadata != null) {
            merged.putAll(metadata);
        }

        return jdbcClient.sql("""
                INSERT INTO ledger_entries
                    (user_id, type, amount_cents, request_id, thread_id, message_id, model_id, provider, metadata)
                VALUES
                    (:userId, :type, :amount, :requestId, :threadId, :messageId, :modelId, :provider, CAST(:metadata AS jsonb))
                RETURNING *
                """)
            .param("userId", userId)
            .param("type", type.dbValue())
            .param("amount", amountCents)
            .param("requestId", correlation.requestId(), Types.VARCHAR)
            .param("threadId", correlation.threadId(), Types.OTHER)
            .param("messageId", correlation.messageId(), Types.OTHER)
            .param("modelId", correlation.modelId(), Types.VARCHAR)
            .param("provider", correlation.provider(), Types.VARCHAR)
            .param("metadata", merged.isEmpty() ? null : writeJson(merged), Types.VARCHAR)
            .query(entryRowMapper)
            .single();
    }

    @Override
    public List<LedgerEntry> findByRequestId(String requestId) {
        return jdbcClient.sql("SELECT * FROM ledger_entries WHERE request_id = :requestId ORDER BY created_at, id")
            .param("requestId", requestId)
            .query(entryRowMapper)
            .list();
    }

    @Override
    public List<LedgerEntry> findByUserId(String userId, int limit) {
        return jdbcClient.sql("SELECT * FROM ledger_entries WHERE user_id = :userId ORDER BY created_at DESC, id LIMIT :limit")
            .param("userId", userId)
            .param("limit", limit)
            .query(entryRowMapper)
            .list();
    }

    @SneakyThrows
    private String writeJson(Map<String, Object> value) {
        return objectMapper.writeValueAsString(value);
    }

    @SneakyThrows
    private Map<String, Object> readJson(String json) {
        return json == null ? Map.of() : objectMapper.readValue(json, JSON_MAP);
    }
}
