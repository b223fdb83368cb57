package com.nevis.chat.infra;

import com.nevis.chat.exception.RateLimitExceededException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryRpmRateLimiterTest {

    @Test
    void shouldAllowUpToLimitPerKey() {
        InMemoryRpmRateLimiter limiter = new InMemoryRpmRateLimiter(2);

        assertThat(limiter.tryAcquire("alice")).isTrue();
        assertThat(limiter.tryAcquire("alice")).isTrue();
        assertThat(limiter.tryAcquire("alice")).isFalse();
        assertThat(limiter.tryAcquire("bob")).isTrue();
    }

    @Test
    void shouldThrowWhenExhausted() {
        InMemoryRpmRateLimiter limiter = new InMemoryRpmRateLimiter(1);
        limiter.acquireOrThrow("alice");

        assertThatThrownBy(() -> limiter.acquireOrThrow("alice"))
            .isInstanceOfSatisfying(RateLimitExceededException.class, e -> {
                assertThat(e.getCode()).isEqualTo("rate_limited");
                assertThat(e.getKey()).isEqualTo("alice");
            });
    }
}
