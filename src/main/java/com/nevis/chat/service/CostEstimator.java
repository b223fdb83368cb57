package com.nevis.chat.service;

import com.nevis.chat.config.TurnProperties;
import com.nevis.chat.exception.InvalidTurnRequestException;
import com.nevis.chat.infra.TokenEstimator;
import com.nevis.chat.model.ConversationMessage;
import com.nevis.chat.model.CostEstimate;
import com.nevis.chat.model.CostMetrics;
import com.nevis.chat.model.ModelSpec;
import com.nevis.chat.model.PricingTier;
import com.nevis.chat.model.UsageMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns token counts into USD and cents. Estimates are inflated by the reservation multiplier
 * so the reserve usually covers the measured cost.
 */
@Component
@RequiredArgsConstructor
public class CostEstimator {

    private static final double TOKENS_PER_MILLION = 1_000_000d;

    private final TurnProperties turnProperties;

    public static CostMetrics calculateCost(UsageMetrics usage, ModelSpec model) {
        if (model == null || !model.hasPricing()) {
            return CostMetrics.unpriced();
        }

        boolean longContext = model.hasLongContextTier()
            && usage.inputTokens() > model.longContextThresholdTokens();
        double inputRate = longContext ? model.longContextInputPerMillionUsd() : model.inputPerMillionUsd();
        double outputRate = longContext ? model.longContextOutputPerMillionUsd() : model.outputPerMillionUsd();

        double inputCost = usage.inputTokens() / TOKENS_PER_MILLION * inputRate;
        double outputCost = usage.outputTokens() / TOKENS_PER_MILLION * outputRate;

        return new CostMetrics(
            inputCost,
            outputCost,
            inputCost + outputCost,
            inputRate,
            outputRate,
            longContext ? PricingTier.LONG_CONTEXT : PricingTier.STANDARD,
            true
        );
    }

    public static long usdToCentsCeil(double usd) {
        if (!Double.isFinite(usd) || usd <= 0) {
            return 0;
        }
        return (long) Math.ceil(usd * 100);
    }

    /**
     * Upper bound for one turn: the whole prompt plus {@code maxOutputTokens} of output, at least one cent.
     *
     * @throws InvalidTurnRequestException when the model has no pricing
     */
    public CostEstimate estimateMaxTurnCost(ModelSpec model, String systemPrompt,
                                            List<ConversationMessage> messages, int maxOutputTokens) {
        String promptText = systemPrompt + "\n" + messages.stream()
            .map(ConversationMessage::content)
            .collect(Collectors.joining("\n"));

        int inputTokens = Math.max(1, TokenEstimator.estimate(promptText));
        int outputTokens = Math.max(1, maxOutputTokens);

        CostMetrics cost = calculateCost(new UsageMetrics(inputTokens, outputTokens, inputTokens + outputTokens), model);
        if (!cost.hasPricing()) {
            throw new InvalidTurnRequestException(
                "Selected model pricing is unavailable for budget enforcement.", "pricing_unavailable");
        }

        double inflatedUsd = cost.totalCostUsd() * turnProperties.reservationSafetyMultiplier();
        long cents = Math.max(1, (long) Math.ceil(inflatedUsd * 100));
        return new CostEstimate(inputTokens, outputTokens, inflatedUsd, cents, cost.pricingTier());
    }
}
