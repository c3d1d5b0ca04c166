package org.learningjava.biasscore.domain.error;

public enum ScoringErrorKind {
    /** Every non-ensemble input score carried confidence 0 (or unreadable metadata). */
    ALL_SCORES_ZERO_CONFIDENCE("all LLMs returned zero confidence"),
    /** No perspective survived selection, or every survivor was exactly 0. */
    ALL_PERSPECTIVES_INVALID("all perspectives invalid"),
    /** Primary credential rate-limited and the backup was absent or rate-limited too. */
    BOTH_LLM_KEYS_RATE_LIMITED("both LLM API keys are rate limited"),
    PROVIDER("LLM provider error"),
    PERSISTENCE("score persistence failed"),
    CANCELLED("scoring cancelled");

    private final String defaultMessage;

    ScoringErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
