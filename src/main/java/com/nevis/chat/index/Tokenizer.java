package com.nevis.chat.index;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text normalization shared by index build and query parsing.
 */
public final class Tokenizer {

    static final Set<String> STOPWORDS = Set.of(
        "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "how", "i", "if", "in", "is", "it",
        "of", "on", "or", "that", "the", "this", "to", "was", "what", "when", "where", "which", "who", "why",
        "with", "you", "your"
    );

    private static final Pattern QUOTE_MARKER = Pattern.compile("(?m)^>\\s?");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Tokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String normalized = Normalizer.normalize(text.toLowerCase(Locale.ROOT), Normalizer.Form.NFKD);
        String alphanumeric = NON_ALPHANUMERIC.matcher(normalized).replaceAll(" ");

        return Arrays.stream(WHITESPACE.split(alphanumeric))
            .filter(token -> token.length() > 1)
            .filter(token -> !STOPWORDS.contains(token))
            .toList();
    }

    public static String clean(String text) {
        if (text == null) {
            return "";
        }
        String unquoted = QUOTE_MARKER.matcher(text.replace("\r", "")).replaceAll("");
        String spaced = HORIZONTAL_SPACE.matcher(unquoted.replace('\u00a0', ' ')).replaceAll(" ");
        return BLANK_LINES.matcher(spaced).replaceAll("\n\n").trim();
    }

    public static String compactWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
