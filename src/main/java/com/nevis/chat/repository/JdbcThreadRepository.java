package com.nevis.chat.repository;

import com.nevis.chat.exception.EntityNotFoundException;
import com.nevis.chat.model.ChatThread;
import com.nevis.chat.model.ThreadVisibility;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcThreadRepository implements ThreadRepository {

    private final JdbcClient jdbcClient;

    @Override
    @Transactional
    public ChatThread save(ChatThread thread) {
        UUID id = jdbcClient.sql("""
                INSERT INTO chat_threads (title, visibility, created_by_user_id)
                VALUES (:title, :visibility, :createdBy)
                RETURNING id
                """)
            .param("title", thread.title() == null ? ChatThread.DEFAULT_TITLE : thread.title())
            .param("visibility", thread.visibility().name().toLowerCase())
            .param("createdBy", thread.createdByUserId())
            .query(UUID.class)
            .single();

        if (thread.participantIds() != null) {
            thread.participantIds().forEach(userId -> addParticipant(id, userId));
        }
        return findById(id).orElseThrow(() -> EntityNotFoundException.thread(id));
    }

    @Override
    public Optional<ChatThread> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM chat_threads WHERE id = :id")
            .param("id", id)
            .query((rs, rowNum) -> new ChatThread(
                rs.getObject("id", UUID.class),
                rs.getString("title"),
                ThreadVisibility.valueOf(rs.getString("visibility").toUpperCase()),
                rs.getString("created_by_user_id"),
                findParticipants(id),
                rs.getObject("created_at", OffsetDateTime.class),
                rs.getObject("updated_at", OffsetDateTime.class)
            ))
            .optional();
    }

    @Override
    public void addParticipant(UUID threadId, String userId) {
        jdbcClient.sql("""
                INSERT INTO thread_participants (thread_id, user_id)
                VALUES (:threadId, :userId)
                ON CONFLICT DO NOTHING
                """)
            .param("threadId", threadId)
            .param("userId", userId)
            .update();
    }

    @Override
    public void recordReply(UUID threadId, String derivedTitle) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE chat_threads
                SET title = CASE WHEN title = :defaultTitle THEN :title ELSE title END,
                    updated_at = NOW()
                WHERE id = :id
                """)
            .param("defaultTitle", ChatThread.DEFAULT_TITLE)
            .param("title", derivedTitle)
            .param("id", threadId)
            .update();

        if (rowsAffected == 0) {
            throw EntityNotFoundException.thread(threadId);
        }
    }

    private List<String> findParticipants(UUID threadId) {
        return jdbcClient.sql("SELECT user_id FROM thread_participants WHERE thread_id = :threadId ORDER BY user_id")
            .param("threadId", threadId)
            .query(String.class)
            .list();
    }
}
