package com.nevis.chat.infra;

import com.nevis.chat.config.ProviderProperties;
import com.nevis.chat.model.ConversationMessage;
import com.nevis.chat.model.MessageRole;
import com.nevis.chat.model.ModelSpec;
import com.nevis.chat.model.ProviderRequest;
import com.nevis.chat.model.ProviderResponse;
import com.nevis.chat.model.UsageMetrics;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class LangChainProviderClient implements ProviderClient {

    private final ChatModelFactory chatModelFactory;
    private final ProviderProperties providerProperties;

    @Override
    public ProviderResponse chat(ProviderRequest request) {
        ModelSpec model = request.model();
        String apiKey = resolveApiKey(request);

        ChatModel chatModel = chatModelFactory.create(model, apiKey, request.temperature(), request.maxOutputTokens());

        log.debug("Calling {} with {} history messages", model.id(), request.messages().size());
        ChatResponse response = chatModel.chat(ChatRequest.builder()
            .messages(toChatMessages(request))
            .build());

        String text = response.aiMessage() == null || response.aiMessage().text() == null
            ? ""
            : response.aiMessage().text().trim();

        String promptText = request.systemPrompt() + "\n" + request.messages().stream()
            .map(ConversationMessage::content)
            .collect(Collectors.joining("\n"));

        return new ProviderResponse(
            model.id(),
            model.provider(),
            model.apiModel(),
            text,
            normalizeUsage(response.tokenUsage(), promptText, text)
        );
    }

    private String resolveApiKey(ProviderRequest request) {
        if (request.apiKeyOverride() != null && !request.apiKeyOverride().isBlank()) {
            return request.apiKeyOverride().trim();
        }
        return providerProperties.houseKey(request.model().provider())
            .orElseThrow(() -> new IllegalStateException("No API key configured for provider " + request.model().provider().wireName()));
    }

    private List<ChatMessage> toChatMessages(ProviderRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(request.systemPrompt()));
        for (ConversationMessage message : request.messages()) {
            if (message.role() == MessageRole.ASSISTANT) {
                messages.add(AiMessage.from(message.content()));
            } else if (message.role() == MessageRole.USER) {
                messages.add(UserMessage.from(message.content()));
            }
        }
        return messages;
    }

    /**
     * Helper method filling gaps in provider-reported usage with local estimates.
     */
    static UsageMetrics normalizeUsage(TokenUsage usage, String promptText, String outputText) {
        Integer reportedInput = usage == null ? null : usage.inputTokenCount();
        Integer reportedOutput = usage == null ? null : usage.outputTokenCount();
        Integer reportedTotal = usage == null ? null : usage.totalTokenCount();

        int input = reportedInput != null ? reportedInput : TokenEstimator.estimate(promptText);
        int output = reportedOutput != null ? reportedOutput : TokenEstimator.estimate(outputText);
        int total = reportedTotal != null ? reportedTotal : input + output;
        return new UsageMetrics(input, output, total);
    }
}
