package com.nevis.chat.model;

import java.util.Optional;

/**
 * A model identifier of the form {@code provider:apiModel}.
 */
public record ModelId(ProviderId provider, String apiModel) {

    public static Optional<ModelId> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        int separator = value.indexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            return Optional.empty();
        }
        String apiModel = value.substring(separator + 1).trim();
        if (apiModel.isEmpty()) {
            return Optional.empty();
        }
        return ProviderId.fromWire(value.substring(0, separator))
            .map(provider -> new ModelId(provider, apiModel));
    }

    public String value() {
        return provider.wireName() + ":" + apiModel;
    }
}
