package com.nevis.chat.infra;

import com.nevis.chat.exception.RateLimitExceededException;

public interface RateLimiter {

    boolean tryAcquire(String key);

    default void acquireOrThrow(String key) {
        if (!tryAcquire(key)) {
            throw new RateLimitExceededException(key);
        }
    }
}
