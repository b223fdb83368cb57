package com.nevis.chat.model;

/**
 * Output of the prepare stage. Holds the decrypted personal key when one was selected,
 * so {@link #toString()} never prints it.
 */
public record PreparedTurn(
    String userId,
    ChatThread thread,
    ThreadMessage userMessage,
    ModelSpec model,
    String apiKeyOverride,
    boolean personalCredential,
    String credentialId,
    boolean credentialAuditLogged,
    String requestId,
    int topK,
    double temperature,
    int maxOutputTokens
) {

    public ProviderId provider() {
        return model.provider();
    }

    public BillingMode billingMode() {
        return personalCredential ? BillingMode.PERSONAL_KEY : BillingMode.HOUSE_KEY;
    }

    public LedgerCorrelation correlation() {
        return new LedgerCorrelation(requestId, thread.id(), null, model.id(), model.provider().wireName(), null);
    }

    @Override
    public String toString() {
        return "PreparedTurn[requestId=" + requestId + ", threadId=" + thread.id() + ", model=" + model.id()
            + ", billingMode=" + billingMode().wireName() + ", topK=" + topK + "]";
    }
}
