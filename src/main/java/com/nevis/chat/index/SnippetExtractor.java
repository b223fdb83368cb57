package com.nevis.chat.index;

import java.util.Collection;

public final class SnippetExtractor {

    static final int WINDOW_SIZE = 280;
    static final int LEAD = 90;
    static final int FALLBACK_LENGTH = 220;
    private static final String ELLIPSIS = "...";

    private SnippetExtractor() {
    }

    public static String extract(String text, Collection<String> queryTerms) {
        int firstHit = -1;

        for (String term : queryTerms) {
            int idx = indexOfIgnoreCase(text, term);
            if (idx != -1 && (firstHit == -1 || idx < firstHit)) {
                firstHit = idx;
            }
        }

        if (firstHit == -1) {
            String compact = Tokenizer.compactWhitespace(text);
            return compact.length() > FALLBACK_LENGTH ? compact.substring(0, FALLBACK_LENGTH) + ELLIPSIS : compact;
        }

        int start = Math.min(text.length(), Math.max(0, firstHit - LEAD));
        int end = Math.min(text.length(), start + WINDOW_SIZE);
        String prefix = start > 0 ? ELLIPSIS : "";
        String suffix = end < text.length() ? ELLIPSIS : "";
        return prefix + Tokenizer.compactWhitespace(text.substring(start, end)) + suffix;
    }

    // Offsets must stay valid in the original text, so no String.toLowerCase (it can change length).
    static int indexOfIgnoreCase(String text, String term) {
        if (term.isEmpty()) {
            return -1;
        }
        int last = text.length() - term.length();
        for (int i = 0; i <= last; i++) {
            if (text.regionMatches(true, i, term, 0, term.length())) {
                return i;
            }
        }
        return -1;
    }
}
