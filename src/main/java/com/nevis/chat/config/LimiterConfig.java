package com.nevis.chat.config;

import com.nevis.chat.infra.InMemoryRpmRateLimiter;
import com.nevis.chat.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("turnLimiter")
    public RateLimiter turnLimiter(TurnProperties turnProperties) {
        return new InMemoryRpmRateLimiter(turnProperties.rateLimitPerMinute());
    }
}
