package org.learningjava.biasscore.domain.service.prompting;

public enum PromptVariant {
    DEFAULT("default"),           // plain bias question
    LEFT_FOCUS("left_focus"),     // read from a progressive viewpoint
    CENTER_FOCUS("center_focus"), // read from a centrist viewpoint
    RIGHT_FOCUS("right_focus");   // read from a conservative viewpoint

    private final String id;

    PromptVariant(String id) {
        this.id = id;
    }

    /** Identifier recorded in ensemble metadata. */
    public String id() {
        return id;
    }
}
