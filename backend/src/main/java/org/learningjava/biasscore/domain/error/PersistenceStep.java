package org.learningjava.biasscore.domain.error;

public enum PersistenceStep {
    BEGIN("DB Transaction", 0),
    INSERT("DB Insert", 70),
    UPDATE("DB Update", 90),
    COMMIT("DB Commit", 95);

    private final String label;
    private final int percent;

    PersistenceStep(String label, int percent) {
        this.label = label;
        this.percent = percent;
    }

    /** Step name shown in progress state. */
    public String label() {
        return label;
    }

    /** Progress percentage reported when this step fails. */
    public int percent() {
        return percent;
    }
}
