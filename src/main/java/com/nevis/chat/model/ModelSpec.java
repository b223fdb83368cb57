package com.nevis.chat.model;

public record ModelSpec(
    String id,
    ProviderId provider,
    String apiModel,
    String label,
    Double inputPerMillionUsd,
    Double outputPerMillionUsd,
    Integer longContextThresholdTokens,
    Double longContextInputPerMillionUsd,
    Double longContextOutputPerMillionUsd
) {
    public static ModelSpec standard(ProviderId provider, String apiModel, String label, double input, double output) {
        return new ModelSpec(provider.wireName() + ":" + apiModel, provider, apiModel, label, input, output, null, null, null);
    }

    public static ModelSpec tiered(ProviderId provider, String apiModel, String label, double input, double output,
                                   int threshold, double longInput, double longOutput) {
        return new ModelSpec(provider.wireName() + ":" + apiModel, provider, apiModel, label, input, output,
            threshold, longInput, longOutput);
    }

    public static ModelSpec unpriced(ProviderId provider, String apiModel) {
        return new ModelSpec(provider.wireName() + ":" + apiModel, provider, apiModel, apiModel, null, null, null, null, null);
    }

    public boolean hasPricing() {
        return inputPerMillionUsd != null && outputPerMillionUsd != null;
    }

    public boolean hasLongContextTier() {
        return longContextThresholdTokens != null
            && longContextInputPerMillionUsd != null
            && longContextOutputPerMillionUsd != null;
    }

    public ModelSpec withPricingOf(ModelSpec priced) {
        return new ModelSpec(id, provider, apiModel, label,
            priced.inputPerMillionUsd, priced.outputPerMillionUsd,
            priced.longContextThresholdTokens, priced.longContextInputPerMillionUsd, priced.longContextOutputPerMillionUsd);
    }
}
