package org.learningjava.biasscore.domain.error;

import java.util.Objects;

/**
 * Root of every failure the scoring layer reports. The {@link ScoringErrorKind} is the
 * identity of the error; callers branch on it with {@link #is(ScoringErrorKind)} or,
 * when the exception may have been wrapped, {@link #isKind(Throwable, ScoringErrorKind)}.
 */
public class ScoringException extends RuntimeException {

    private final ScoringErrorKind kind;

    public ScoringException(ScoringErrorKind kind) {
        this(kind, kind.defaultMessage(), null);
    }

    public ScoringException(ScoringErrorKind kind, String message) {
        this(kind, message, null);
    }

    public ScoringException(ScoringErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ScoringErrorKind kind() {
        return kind;
    }

    public boolean is(ScoringErrorKind k) {
        return kind == k;
    }

    /** Walks the cause chain looking for a {@link ScoringException} of the given kind. */
    public static boolean isKind(Throwable t, ScoringErrorKind k) {
        Throwable cur = t;
        int depth = 0;
        while (cur != null && depth++ < 32) {
            if (cur instanceof ScoringException se && se.kind == k) return true;
            if (cur.getCause() == cur) break;
            cur = cur.getCause();
        }
        return false;
    }
}
