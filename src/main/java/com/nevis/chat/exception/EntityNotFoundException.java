package com.nevis.chat.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.UUID;

@Getter
public class EntityNotFoundException extends TurnException {
    private final UUID entityId;

    public EntityNotFoundException(String entityName, UUID entityId, String code) {
        super(entityName + " not found: " + entityId, code, HttpStatus.NOT_FOUND);
        this.entityId = entityId;
    }

    public static EntityNotFoundException thread(UUID threadId) {
        return new EntityNotFoundException("Thread", threadId, "thread_not_found");
    }

    public static EntityNotFoundException message(UUID messageId) {
        return new EntityNotFoundException("Message", messageId, "message_not_found");
    }
}
