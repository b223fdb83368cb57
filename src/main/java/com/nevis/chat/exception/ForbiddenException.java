package com.nevis.chat.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.UUID;

@Getter
public class ForbiddenException extends TurnException {
    private final UUID threadId;

    public ForbiddenException(UUID threadId) {
        super("Forbidden: no access to thread " + threadId, "forbidden", HttpStatus.FORBIDDEN);
        this.threadId = threadId;
    }
}
