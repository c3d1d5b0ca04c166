package org.learningjava.biasscore.domain.error;

import java.util.Locale;

public enum ProviderErrorCategory {
    RATE_LIMIT("rate_limit", "LLM rate limit exceeded"),
    AUTHENTICATION("authentication", "LLM authentication failed"),
    INSUFFICIENT_CREDITS("credits", "LLM credits exhausted"),
    STREAMING("streaming", "LLM streaming failed"),
    UNKNOWN("unknown", "LLM service error");

    private final String code;
    private final String prefix;

    ProviderErrorCategory(String code, String prefix) {
        this.code = code;
        this.prefix = prefix;
    }

    /** Short identifier used in progress error details. */
    public String code() {
        return code;
    }

    public String prefix() {
        return prefix;
    }

    public static ProviderErrorCategory classify(int statusCode, String message) {
        ProviderErrorCategory byStatus = switch (statusCode) {
            case 429 -> RATE_LIMIT;
            case 401 -> AUTHENTICATION;
            case 402 -> INSUFFICIENT_CREDITS;
            default -> null;
        };
        if (byStatus != null) return byStatus;
        String m = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (m.contains("stream") || m.contains("sse")) return STREAMING;
        return UNKNOWN;
    }
}
