package com.nevis.chat.service;

import com.nevis.chat.model.ModelSpec;
import com.nevis.chat.model.ProviderId;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static com.nevis.chat.model.ProviderId.ANTHROPIC;
import static com.nevis.chat.model.ProviderId.GEMINI;
import static com.nevis.chat.model.ProviderId.OPENAI;

/**
 * Built-in models with list prices in USD per million tokens.
 */
public final class ModelPresets {

    public static final int LONG_CONTEXT_THRESHOLD_TOKENS = 200_000;

    public static final List<ModelSpec> ALL = List.of(
        ModelSpec.standard(OPENAI, "gpt-5", "GPT-5", 1.25, 10),
        ModelSpec.standard(OPENAI, "gpt-5-mini", "GPT-5 mini", 0.25, 2),
        ModelSpec.standard(OPENAI, "gpt-5-nano", "GPT-5 nano", 0.05, 0.4),
        ModelSpec.tiered(ANTHROPIC, "claude-opus-4-6", "Claude Opus 4.6", 5, 25,
            LONG_CONTEXT_THRESHOLD_TOKENS, 10, 37.5),
        ModelSpec.tiered(ANTHROPIC, "claude-sonnet-4-5", "Claude Sonnet 4.5", 3, 15,
            LONG_CONTEXT_THRESHOLD_TOKENS, 6, 22.5),
        ModelSpec.standard(ANTHROPIC, "claude-haiku-4-5", "Claude Haiku 4.5", 1, 5),
        ModelSpec.tiered(GEMINI, "gemini-2.5-pro", "Gemini 2.5 Pro", 1.25, 10,
            LONG_CONTEXT_THRESHOLD_TOKENS, 2.5, 15),
        ModelSpec.standard(GEMINI, "gemini-2.5-flash", "Gemini 2.5 Flash", 0.3, 2.5),
        ModelSpec.standard(GEMINI, "gemini-2.5-flash-lite", "Gemini 2.5 Flash-Lite", 0.1, 0.4)
    );

    private ModelPresets() {
    }

    public static Optional<ModelSpec> findById(String modelId) {
        return ALL.stream().filter(spec -> spec.id().equals(modelId)).findFirst();
    }

    public static List<ModelSpec> forProvider(ProviderId provider) {
        return ALL.stream().filter(spec -> spec.provider() == provider).toList();
    }

    /**
     * Builds the catalog entry for a model name reported by a provider. Dated snapshots such as
     * {@code claude-sonnet-4-5-20250929} borrow the price of the longest preset name they start with.
     */
    public static ModelSpec forDiscovered(ProviderId provider, String apiModel) {
        List<ModelSpec> candidates = forProvider(provider);
        Optional<ModelSpec> exact = candidates.stream()
            .filter(spec -> spec.apiModel().equals(apiModel))
            .findFirst();
        if (exact.isPresent()) {
            return exact.get();
        }

        ModelSpec discovered = ModelSpec.unpriced(provider, apiModel);
        return candidates.stream()
            .filter(spec -> apiModel.startsWith(spec.apiModel() + "-"))
            .max(Comparator.comparingInt(spec -> spec.apiModel().length()))
            .map(discovered::withPricingOf)
            .orElse(discovered);
    }
}
