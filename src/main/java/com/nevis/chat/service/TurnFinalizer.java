package com.nevis.chat.service;

import com.nevis.chat.model.AssistantReply;
import com.nevis.chat.model.AuditResult;
import com.nevis.chat.model.BudgetSummary;
import com.nevis.chat.model.ChatThread;
import com.nevis.chat.model.Citation;
import com.nevis.chat.model.CostMetrics;
import com.nevis.chat.model.CredentialAuditEvent;
import com.nevis.chat.model.MessageRole;
import com.nevis.chat.model.PreparedTurn;
import com.nevis.chat.model.ProviderResponse;
import com.nevis.chat.model.RetrievalResult;
import com.nevis.chat.model.SettlementOutcome;
import com.nevis.chat.model.ThreadMessage;
import com.nevis.chat.model.TurnExecution;
import com.nevis.chat.model.TurnResult;
import com.nevis.chat.repository.MessageRepository;
import com.nevis.chat.repository.ThreadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists the answer and settles the reservation. The assistant message, its citations and the
 * thread update commit together; the ledger settles afterwards in its own transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TurnFinalizer {

    static final int MAX_TITLE_LENGTH = 72;
    static final int TRUNCATED_TITLE_LENGTH = 69;

    private final MessageRepository messageRepository;
    private final ThreadRepository threadRepository;
    private final LedgerService ledgerService;
    private final CredentialAuditLogger auditLogger;
    private final TransactionTemplate transactionTemplate;

    public TurnResult finalizeTurn(PreparedTurn prepared, TurnExecution execution) {
        if (prepared.personalCredential() && !prepared.credentialAuditLogged()) {
            auditLogger.log(new CredentialAuditEvent(
                prepared.userId(),
                CredentialAuditEvent.USE_ACTION,
                prepared.credentialId(),
                prepared.provider(),
                AuditResult.SUCCESS,
                prepared.requestId(),
                null
            ));
        }

        List<Citation> citations = toCitations(execution.retrieval());
        ThreadMessage assistantMessage = transactionTemplate.execute(status -> persistReply(prepared, execution, citations));

        BudgetSummary budget;
        if (prepared.personalCredential()) {
            budget = new BudgetSummary(0, 0, 0, ledgerService.balanceOf(prepared.userId()));
        } else {
            SettlementOutcome settled = ledgerService.finalizeReservation(
                prepared.userId(),
                execution.reservedCents(),
                execution.actualCostCents(),
                prepared.correlation()
                    .withMessageId(assistantMessage.id())
                    .withMetadata(Map.of(
                        "pricingTier", execution.measuredCost().pricingTier().label(),
                        "hasPricing", execution.measuredCost().hasPricing()
                    ))
            );
            budget = new BudgetSummary(execution.reservedCents(), settled.debitedCents(),
                settled.releasedCents(), settled.remainingBalanceCents());
        }

        ProviderResponse response = execution.response();
        AssistantReply reply = new AssistantReply(
            assistantMessage.id(),
            assistantMessage.content(),
            prepared.model().id(),
            response.provider(),
            response.usage(),
            execution.measuredCost(),
            execution.actualCostCents(),
            prepared.billingMode(),
            citations,
            assistantMessage.createdAt()
        );
        return new TurnResult(prepared.thread().id(), prepared.userMessage(), reply, budget, citations.size(), prepared.topK());
    }

    /**
     * Collapses whitespace and shortens long first messages to 69 characters plus an ellipsis.
     */
    public static String deriveTitle(String content) {
        String normalized = content == null ? "" : content.replaceAll("\\s+", " ").trim();
        if (normalized.isEmpty()) {
            return ChatThread.DEFAULT_TITLE;
        }
        if (normalized.length() <= MAX_TITLE_LENGTH) {
            return normalized;
        }
        return normalized.substring(0, TRUNCATED_TITLE_LENGTH).stripTrailing() + "...";
    }

    private ThreadMessage persistReply(PreparedTurn prepared, TurnExecution execution, List<Citation> citations) {
        ProviderResponse response = execution.response();
        CostMetrics cost = execution.measuredCost();

        Map<String, Object> usage = new LinkedHashMap<>();
        usage.put("inputTokens", response.usage().inputTokens());
        usage.put("outputTokens", response.usage().outputTokens());
        usage.put("totalTokens", response.usage().totalTokens());
        usage.put("billingMode", prepared.billingMode().wireName());
        usage.put("estimatedReservationCents", execution.reservedCents());
        usage.put("measuredCostUsd", cost.totalCostUsd());
        usage.put("measuredInputCostUsd", cost.inputCostUsd());
        usage.put("measuredOutputCostUsd", cost.outputCostUsd());
        usage.put("measuredHasPricing", cost.hasPricing());

        ThreadMessage saved = messageRepository.save(new ThreadMessage(
            null,
            prepared.thread().id(),
            null,
            MessageRole.ASSISTANT,
            response.text(),
            prepared.model().id(),
            response.provider().wireName(),
            usage,
            execution.actualCostCents(),
            null
        ));

        if (!citations.isEmpty()) {
            messageRepository.saveCitations(saved.id(), citations);
        }

        String title = ChatThread.DEFAULT_TITLE.equals(prepared.thread().title())
            ? deriveTitle(prepared.userMessage().content())
            : prepared.thread().title();
        threadRepository.recordReply(prepared.thread().id(), title);
        return saved;
    }

    private static List<Citation> toCitations(List<RetrievalResult> retrieval) {
        List<Citation> citations = new ArrayList<>(retrieval.size());
        for (int i = 0; i < retrieval.size(); i++) {
            RetrievalResult item = retrieval.get(i);
            citations.add(new Citation(
                i + 1,
                item.passage().chunkId(),
                item.passage().docId(),
                item.passage().url(),
                item.passage().title(),
                item.passage().section(),
                Math.round(item.score() * 10_000d) / 10_000d,
                item.snippet(),
                item.multiplierApplied()
            ));
        }
        return citations;
    }
}
