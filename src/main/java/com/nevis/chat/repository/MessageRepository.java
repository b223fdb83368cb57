package com.nevis.chat.repository;

import com.nevis.chat.model.Citation;
import com.nevis.chat.model.ThreadMessage;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MessageRepository {

    ThreadMessage save(ThreadMessage message);

    Optional<ThreadMessage> findById(UUID id);

    /**
     * The newest {@code limit} messages of a thread, returned oldest first.
     */
    List<ThreadMessage> findRecentByThread(UUID threadId, int limit);

    void saveCitations(UUID messageId, List<Citation> citations);

    List<Citation> findCitations(UUID messageId);
}
