package com.nevis.chat.model;

import java.util.List;

public record ProviderRequest(
    ModelSpec model,
    List<ConversationMessage> messages,
    String systemPrompt,
    double temperature,
    int maxOutputTokens,
    String apiKeyOverride
) {
    @Override
    public String toString() {
        return "ProviderRequest[model=" + model.id() + ", messages=" + messages.size()
            + ", maxOutputTokens=" + maxOutputTokens + ", personalKey=" + (apiKeyOverride != null) + "]";
    }
}
