package com.nevis.chat.config;

import com.nevis.chat.model.ProviderId;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Optional;

/**
 * House credentials and connection settings for the upstream model providers.
 */
@Validated
@ConfigurationProperties(prefix = "app.providers")
public record ProviderProperties(
    String openaiApiKey,
    String anthropicApiKey,
    String geminiApiKey,
    @DefaultValue("https://api.openai.com/v1") String openaiBaseUrl,
    @DefaultValue("https://api.anthropic.com") String anthropicBaseUrl,
    @DefaultValue("https://generativelanguage.googleapis.com/v1beta") String geminiBaseUrl,
    @NotNull @DefaultValue("60s") Duration timeout,
    @Min(0) @DefaultValue("2") int maxRetries,
    @DefaultValue("false") boolean logRequests,
    @DefaultValue("true") boolean discoveryEnabled,
    @NotNull @DefaultValue("7s") Duration discoveryTimeout,
    @NotNull @DefaultValue("5m") Duration discoveryCacheTtl
) {

    public Optional<String> houseKey(ProviderId provider) {
        String value = switch (provider) {
            case OPENAI -> openaiApiKey;
            case ANTHROPIC -> anthropicApiKey;
            case GEMINI -> geminiApiKey;
        };
        return Optional.ofNullable(value).map(String::trim).filter(v -> !v.isEmpty());
    }

    public boolean hasHouseKey(ProviderId provider) {
        return houseKey(provider).isPresent();
    }

    public String baseUrl(ProviderId provider) {
        String value = switch (provider) {
            case OPENAI -> openaiBaseUrl;
            case ANTHROPIC -> anthropicBaseUrl;
            case GEMINI -> geminiBaseUrl;
        };
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    @Override
    public String toString() {
        return "ProviderProperties[openai=" + hasHouseKey(ProviderId.OPENAI)
            + ", anthropic=" + hasHouseKey(ProviderId.ANTHROPIC)
            + ", gemini=" + hasHouseKey(ProviderId.GEMINI) + ", timeout=" + timeout + "]";
    }
}
