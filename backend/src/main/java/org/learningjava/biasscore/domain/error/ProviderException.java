package org.learningjava.biasscore.domain.error;

import java.time.Duration;

/**
 * A provider call that failed after the adapter's own retries. The message is built
 * from an already-sanitized response body and never contains a credential.
 */
public class ProviderException extends ScoringException {

    private final ProviderErrorCategory category;
    private final int statusCode;
    private final Duration retryAfter;

    public ProviderException(ProviderErrorCategory category, int statusCode, String detail, Duration retryAfter) {
        this(category, statusCode, detail, retryAfter, null);
    }

    public ProviderException(ProviderErrorCategory category, int statusCode, String detail,
                             Duration retryAfter, Throwable cause) {
        super(ScoringErrorKind.PROVIDER, category.prefix() + ": " + (detail == null ? "" : detail), cause);
        this.category = category;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
    }

    public ProviderErrorCategory category() {
        return category;
    }

    public int statusCode() {
        return statusCode;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
