package com.nevis.chat.config;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.retrieval")
public record RetrievalProperties(
    @NotNull @DefaultValue("30s") Duration signalCacheTtl
) {}
