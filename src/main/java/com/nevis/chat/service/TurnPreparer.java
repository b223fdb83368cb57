package com.nevis.chat.service;

import com.nevis.chat.config.ProviderProperties;
import com.nevis.chat.exception.EntityNotFoundException;
import com.nevis.chat.exception.ForbiddenException;
import com.nevis.chat.exception.InvalidTurnRequestException;
import com.nevis.chat.model.ChatThread;
import com.nevis.chat.model.ModelSpec;
import com.nevis.chat.model.PreparedTurn;
import com.nevis.chat.model.ThreadMessage;
import com.nevis.chat.model.TurnCommand;
import com.nevis.chat.repository.MessageRepository;
import com.nevis.chat.repository.ThreadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Validates a turn and resolves everything the provider call needs. The only write is the user message.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TurnPreparer {

    static final int MIN_TOP_K = 2;
    static final int MAX_TOP_K = 10;
    static final int DEFAULT_TOP_K = 6;
    static final double MIN_TEMPERATURE = 0;
    static final double MAX_TEMPERATURE = 1.2;
    static final double DEFAULT_TEMPERATURE = 0.2;
    static final int MIN_OUTPUT_TOKENS = 128;
    static final int MAX_OUTPUT_TOKENS = 4096;
    static final int DEFAULT_OUTPUT_TOKENS = 1200;

    private final ThreadRepository threadRepository;
    private final MessageRepository messageRepository;
    private final ModelCatalogService modelCatalogService;
    private final CredentialService credentialService;
    private final ProviderProperties providerProperties;

    public PreparedTurn prepare(TurnCommand command) {
        ChatThread thread = threadRepository.findById(command.threadId())
            .orElseThrow(() -> EntityNotFoundException.thread(command.threadId()));

        if (!thread.isAccessibleBy(command.userId())) {
            throw new ForbiddenException(thread.id());
        }

        String content = command.content() == null ? "" : command.content().trim();
        if (content.isEmpty()) {
            throw new InvalidTurnRequestException("Message content is required.", "missing_content");
        }

        String requestId = UUID.randomUUID().toString();
        ThreadMessage userMessage = messageRepository.save(ThreadMessage.userMessage(thread.id(), command.userId(), content));

        ModelSpec model = modelCatalogService.resolve(command.modelId());

        String apiKeyOverride = null;
        boolean personal = command.credentialId() != null;
        if (personal) {
            apiKeyOverride = credentialService.resolveForTurn(
                command.userId(), command.credentialId(), model.provider(), model.id(), requestId);
        } else if (!providerProperties.hasHouseKey(model.provider())) {
            throw new InvalidTurnRequestException(
                "No server API key is configured for " + model.provider().wireName() + ".", "missing_provider_key");
        }

        int topK = (int) Math.round(clamp(command.topK(), MIN_TOP_K, MAX_TOP_K, DEFAULT_TOP_K));
        double temperature = clamp(command.temperature(), MIN_TEMPERATURE, MAX_TEMPERATURE, DEFAULT_TEMPERATURE);
        int maxOutputTokens = (int) Math.round(
            clamp(command.maxOutputTokens(), MIN_OUTPUT_TOKENS, MAX_OUTPUT_TOKENS, DEFAULT_OUTPUT_TOKENS));

        PreparedTurn prepared = new PreparedTurn(
            command.userId(),
            thread,
            userMessage,
            model,
            apiKeyOverride,
            personal,
            personal ? command.credentialId().toString() : null,
            false,
            requestId,
            topK,
            temperature,
            maxOutputTokens
        );
        log.debug("Prepared {}", prepared);
        return prepared;
    }

    static double clamp(Double value, double min, double max, double fallback) {
        if (value == null || !Double.isFinite(value)) {
            return fallback;
        }
        return Math.max(min, Math.min(max, value));
    }
}
