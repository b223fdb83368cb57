package com.nevis.chat.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.turn")
public record TurnProperties(
    @Min(1) @DefaultValue("24") int historyWindow,
    @Min(1) @DefaultValue("12") int maxHistoryMessages,
    @NotBlank @DefaultValue("openai:gpt-5-mini") String defaultModelId,
    @DecimalMin("1.0") @DefaultValue("1.25") double reservationSafetyMultiplier,
    @Min(1) @DefaultValue("20") int rateLimitPerMinute,
    @DefaultValue("false") boolean allowClientKeyOverride
) {}
