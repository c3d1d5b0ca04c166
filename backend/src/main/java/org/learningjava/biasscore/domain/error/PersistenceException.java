package org.learningjava.biasscore.domain.error;

public class PersistenceException extends ScoringException {

    private final PersistenceStep step;

    public PersistenceException(PersistenceStep step, String message, Throwable cause) {
        super(ScoringErrorKind.PERSISTENCE, message, cause);
        this.step = step;
    }

    public PersistenceStep step() {
        return step;
    }
}
