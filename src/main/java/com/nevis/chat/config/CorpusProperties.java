package com.nevis.chat.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.corpus")
public record CorpusProperties(
    @NotBlank @DefaultValue("data/chunks.jsonl") String path,
    @DefaultValue("false") boolean warmOnStartup
) {}
