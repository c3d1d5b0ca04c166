package org.learningjava.biasscore.domain.model;

import java.util.Locale;
import java.util.Optional;

public enum Perspective {
    LEFT("left"),
    CENTER("center"),
    RIGHT("right");

    private final String label;

    Perspective(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<Perspective> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String l = label.trim().toLowerCase(Locale.ROOT);
        for (Perspective p : values()) {
            if (p.label.equals(l)) return Optional.of(p);
        }
        return Optional.empty();
    }
}
