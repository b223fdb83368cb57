package com.nevis.chat.repository;

import com.nevis.chat.model.ChatThread;

import java.util.Optional;
import java.util.UUID;

public interface ThreadRepository {

    ChatThread save(ChatThread thread);

    Optional<ChatThread> findById(UUID id);

    void addParticipant(UUID threadId, String userId);

    /**
     * Bumps {@code updated_at} and replaces the title only while it is still the default one.
     */
    void recordReply(UUID threadId, String derivedTitle);
}
