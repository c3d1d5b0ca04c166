package org.learningjava.biasscore.application.progress;

public enum ProgressStatus {
    IN_PROGRESS("InProgress"),
    SUCCESS("Success"),
    ERROR("Error");

    private final String label;

    ProgressStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
