package com.nevis.chat.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.util.Map;

@Repository
@RequiredArgsConstructor
public class JdbcAuditLogRepository implements AuditLogRepository {

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    @Override
    @SneakyThrows
    public void save(String actorUserId, String action, String targetType, String targetId, Map<String, Object> metadata) {
        jdbcClient.sql("""
                INSERT INTO audit_logs (actor_user_id, action, target_type, target_id, metadata)
                VALUES (:actor, :action, :targetType, :targetId, CAST(:metadata AS jsonb))
                """)
            .param("actor", actorUserId)
            .param("action", action)
            .param("targetType", targetType)
            .param("targetId", targetId, Types.VARCHAR)
            .param("metadata", objectMapper.writeValueAsString(metadata))
            .update();
    }

    @Override
    public int countByActionAndTarget(String action, String targetId) {
        return jdbcClient.sql("SELECT COUNT(*) FROM audit_logs WHERE action = :action AND target_id = :targetId")
            .param("action", action)
            .param("targetId", targetId)
            .query(Integer.class)
            .single();
    }
}
