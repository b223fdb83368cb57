package com.nevis.chat.infra;

public final class TokenEstimator {

    private TokenEstimator() {
    }

    /**
     * Rough token count at four characters per token.
     */
    public static int estimate(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : (int) Math.ceil(trimmed.length() / 4.0);
    }
}
