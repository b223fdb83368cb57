package com.nevis.chat.service;

import com.nevis.chat.config.TurnProperties;
import com.nevis.chat.exception.UpstreamFailureException;
import com.nevis.chat.infra.ProviderClient;
import com.nevis.chat.model.ConversationMessage;
import com.nevis.chat.model.CostEstimate;
import com.nevis.chat.model.CostMetrics;
import com.nevis.chat.model.MessageRole;
import com.nevis.chat.model.PreparedTurn;
import com.nevis.chat.model.ProviderRequest;
import com.nevis.chat.model.ProviderResponse;
import com.nevis.chat.model.RetrievalResult;
import com.nevis.chat.model.TurnExecution;
import com.nevis.chat.repository.MessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Retrieves grounding passages, reserves the estimated cost and calls the provider.
 * Any failure leaves as a {@link TurnExecutionFailure} holding what was reserved.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TurnExecutor {

    private final MessageRepository messageRepository;
    private final RetrievalWeightService retrievalWeightService;
    private final RetrievalService retrievalService;
    private final CostEstimator costEstimator;
    private final LedgerService ledgerService;
    private final ProviderClient providerClient;
    private final TurnProperties turnProperties;

    public TurnExecution execute(PreparedTurn prepared, List<String> sources) {
        long reservedCents = 0;
        try {
            List<ConversationMessage> conversation = messageRepository
                .findRecentByThread(prepared.thread().id(), turnProperties.historyWindow())
                .stream()
                .filter(message -> message.role() == MessageRole.USER || message.role() == MessageRole.ASSISTANT)
                .map(message -> new ConversationMessage(message.role(), message.content()))
                .toList();

            Map<String, Double> multipliers = retrievalWeightService.multipliers();
            List<RetrievalResult> retrieval = retrievalService.retrieve(
                prepared.userMessage().content(), prepared.topK(), multipliers, sources);
            String systemPrompt = PromptBuilder.systemPrompt(retrieval);
            List<ConversationMessage> trimmed =
                PromptBuilder.trimConversation(conversation, turnProperties.maxHistoryMessages());

            CostEstimate estimate = null;
            if (!prepared.personalCredential()) {
                estimate = costEstimator.estimateMaxTurnCost(
                    prepared.model(), systemPrompt, trimmed, prepared.maxOutputTokens());
                ledgerService.reserve(prepared.userId(), estimate.estimatedCostCents(),
                    prepared.correlation().withMetadata(Map.of(
                        "inputTokensEstimate", estimate.inputTokensEstimate(),
                        "outputTokensEstimate", estimate.outputTokensEstimate(),
                        "pricingTier", estimate.pricingTier().label()
                    )));
                reservedCents = estimate.estimatedCostCents();
            }

            ProviderResponse response = callProvider(prepared, systemPrompt, trimmed);

            CostMetrics measured = CostEstimator.calculateCost(response.usage(), prepared.model());
            long actualCostCents = prepared.personalCredential() ? 0 : CostEstimator.usdToCentsCeil(measured.totalCostUsd());

            log.debug("Request {} answered by {}: {} input / {} output tokens, {} cents against {} reserved",
                prepared.requestId(), prepared.model().id(), response.usage().inputTokens(),
                response.usage().outputTokens(), actualCostCents, reservedCents);

            return new TurnExecution(response, measured, actualCostCents, reservedCents, estimate,
                retrieval, systemPrompt, trimmed);
        } catch (RuntimeException e) {
            throw new TurnExecutionFailure(reservedCents, e);
        }
    }

    private ProviderResponse callProvider(PreparedTurn prepared, String systemPrompt, List<ConversationMessage> messages) {
        ProviderRequest request = new ProviderRequest(
            prepared.model(),
            messages,
            systemPrompt,
            prepared.temperature(),
            prepared.maxOutputTokens(),
            prepared.apiKeyOverride()
        );
        try {
            return providerClient.chat(request);
        } catch (RuntimeException e) {
            log.error("Provider call failed for request {} on {}", prepared.requestId(), prepared.model().id(), e);
            throw new UpstreamFailureException(e);
        }
    }
}
