package com.nevis.chat.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-key request budget refilled in full once per minute.
 */
public class InMemoryRpmRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final int rpmLimit;

    public InMemoryRpmRateLimiter(int rpmLimit) {
        this.rpmLimit = rpmLimit;
    }

    private Bucket createBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(rpmLimit, Refill.intervally(rpmLimit, Duration.ofMinutes(1))))
            .build();
    }

    @Override
    public boolean tryAcquire(String key) {
        return buckets.computeIfAbsent(key, k -> createBucket()).tryConsume(1);
    }
}
