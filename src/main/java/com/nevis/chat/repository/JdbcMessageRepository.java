package com.nevis.chat.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.chat.model.Citation;
import com.nevis.chat.model.MessageRole;
import com.nevis.chat.model.ThreadMessage;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcMessageRepository implements MessageRepository {

    private static final TypeReference<Map<String, Object>> JSON_MAP = new TypeReference<>() {};

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private final RowMapper<ThreadMessage> messageRowMapper = (rs, rowNum) -> new ThreadMessage(
        rs.getObject("id", UUID.class),
        rs.getObject("thread_id", UUID.class),
        rs.getString("user_id"),
        MessageRole.fromDb(rs.getString("role")),
        rs.getString("content"),
        rs.getString("model_id"),
        rs.getString("provider"),
        readJson(rs.getString("usage")),
        rs.getObject("cost_cents") == null ? null : rs.getLong("cost_cents"),
        rs.getObject("created_at", OffsetDateTime.class)
    );

    private final RowMapper<Citation> citationRowMapper = (rs, rowNum) -> new Citation(
        rs.getInt("rank"),
        rs.getString("chunk_id"),
        rs.getString("doc_id"),
        rs.getString("url"),
        rs.getString("title"),
        rs.getString("section"),
        rs.getDouble("score"),
        rs.getString("snippet"),
        rs.getDouble("multiplier_applied")
    );

    @Override
    public ThreadMessage save(ThreadMessage message) {
        return jdbcClient.sql("""
                INSERT INTO messages (thread_id, user_id, role, content, model_id, provider, usage, cost_cents)
                VALUES (:threadId, :userId, :role, :content, :modelId, :provider, CAST(:usage AS jsonb), :costCents)
                RETURNING *
                """)
            .param("threadId", message.threadId())
            .param("userId", message.userId())
            .param("role", message.role().dbValue())
            .param("content", message.content())
            .param("modelId", message.modelId())
            .param("provider", message.provider())
            .param("usage", writeJson(message.usage()), Types.VARCHAR)
            .param("costCents", message.costCents(), Types.BIGINT)
            .query(messageRowMapper)
            .single();
    }

    @Override
    public Optional<ThreadMessage> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM messages WHERE id = :id")
            .param("id", id)
            .query(messageRowMapper)
            .optional();
    }

    @Override
    public List<ThreadMessage> findRecentByThread(UUID threadId, int limit) {
        return jdbcClient.sql("""
                SELECT * FROM (
                    SELECT * FROM messages
                    WHERE thread_id = :threadId
                    ORDER BY created_at DESC, id DESC
                    LIMIT :limit
                ) recent
                ORDER BY created_at ASC, id ASC
                """)
            .param("threadId", threadId)
            .param("limit", limit)
            .query(messageRowMapper)
            .list();
    }

    @Override
    public void saveCitations(UUID messageId, List<Citation> citations) {
        if (citations == null || citations.isEmpty()) {
            return;
        }

        String sql = """
            INSERT INTO message_citations
                (message_id, rank, chunk_id, doc_id, url, title, section, score, snippet, multiplier_applied)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                Citation citation = citations.get(i);
                ps.setObject(1, messageId);
                ps.setInt(2, citation.rank());
                ps.setString(3, citation.chunkId());
                ps.setString(4, citation.docId());
                ps.setString(5, citation.url());
                ps.setString(6, citation.title());
                ps.setString(7, citation.section());
                ps.setDouble(8, citation.score());
                ps.setString(9, citation.snippet());
                ps.setDouble(10, citation.multiplierApplied());
            }

            @Override
            public int getBatchSize() {
                return citations.size();
            }
        });
    }

    @Override
    public List<Citation> findCitations(UUID messageId) {
        return jdbcClient.sql("SELECT * FROM message_citations WHERE message_id = :messageId ORDER BY rank")
            .param("messageId", messageId)
            .query(citationRowMapper)
            .list();
    }

    @SneakyThrows
    private String writeJson(Map<String, Object> value) {
        return value == null ? null : objectMapper.writeValueAsString(value);
    }

    @SneakyThrows
    private Map<String, Object> readJson(String json) {
        return json == null ? null : objectMapper.readValue(json, JSON_MAP);
    }
}
