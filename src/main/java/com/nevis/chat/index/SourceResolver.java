package com.nevis.chat.index;

import java.net.URI;
import java.util.Locale;
import java.util.Map;

/**
 * Maps explicit source tags and URLs to the canonical source names used by filters.
 */
public final class SourceResolver {

    public static final String UNKNOWN = "unknown";

    private static final Map<String, String> ALIASES = Map.of(
        "support", "support",
        "support.clever.com", "support",
        "support-clever", "support",
        "dev", "dev",
        "dev.clever.com", "dev",
        "dev-clever", "dev"
    );

    private SourceResolver() {
    }

    public static String resolveSource(String explicitSource, String url) {
        if (explicitSource != null) {
            String alias = ALIASES.get(explicitSource.trim().toLowerCase(Locale.ROOT));
            if (alias != null) {
                return alias;
            }
        }
        return inferFromUrl(url);
    }

    public static String resolveHost(String explicitHost, String url) {
        if (explicitHost != null && !explicitHost.isBlank()) {
            return explicitHost.trim().toLowerCase(Locale.ROOT);
        }
        String host = hostOf(url);
        return host == null ? UNKNOWN : host;
    }

    /**
     * Normalizes a caller-supplied filter value. Known aliases collapse to their canonical name;
     * anything else is matched verbatim against the resolved source.
     */
    public static String normalizeFilter(String value) {
        if (value == null) {
            return "";
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(normalized, normalized);
    }

    static String inferFromUrl(String url) {
        String host = hostOf(url);
        if (host == null) {
            return UNKNOWN;
        }
        return ALIASES.getOrDefault(host, host);
    }

    private static String hostOf(String url) {
        if (url == null) {
            return null;
        }
        try {
            String host = URI.create(url.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
