package com.nevis.chat.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class RateLimitExceededException extends TurnException {
    private final String key;

    public RateLimitExceededException(String key) {
        super("Rate limit exceeded. Please retry shortly.", "rate_limited", HttpStatus.TOO_MANY_REQUESTS);
        this.key = key;
    }
}
