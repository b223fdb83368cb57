package com.nevis.chat.config;

import com.nevis.chat.infra.ChatModelFactory;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LangChainConfig {

    /**
     * Models are built per call because the key, model name and sampling settings vary per turn.
     */
    @Bean
    public ChatModelFactory chatModelFactory(ProviderProperties properties) {
        return (model, apiKey, temperature, maxOutputTokens) -> switch (model.provider()) {
            case OPENAI -> {
                OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                    .baseUrl(properties.baseUrl(model.provider()))
                    .apiKey(apiKey)
                    .modelName(model.apiModel())
                    .timeout(properties.timeout())
                    .maxRetries(properties.maxRetries())
                    .logRequests(properties.logRequests())
                    .logResponses(properties.logRequests());
                // gpt-5 family only accepts the default temperature and the newer token limit field
                if (model.apiModel().startsWith("gpt-5")) {
                    builder.maxCompletionTokens(maxOutputTokens);
                } else {
                    builder.temperature(temperature).maxTokens(maxOutputTokens);
                }
                yield builder.build();
            }
            case ANTHROPIC -> AnthropicChatModel.builder()
                .baseUrl(properties.baseUrl(model.provider()) + "/v1/")
                .apiKey(apiKey)
                .modelName(model.apiModel())
                .temperature(temperature)
                .maxTokens(maxOutputTokens)
                .timeout(properties.timeout())
                .maxRetries(properties.maxRetries())
                .logRequests(properties.logRequests())
                .logResponses(properties.logRequests())
                .build();
            case GEMINI -> GoogleAiGeminiChatModel.builder()
                .apiKey(apiKey)
                .modelName(model.apiModel())
                .temperature(temperature)
                .maxOutputTokens(maxOutputTokens)
                .timeout(properties.timeout())
                .maxRetries(properties.maxRetries())
                .build();
        };
    }
}
