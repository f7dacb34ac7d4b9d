package io.swimset.workout.model;

/**
 * Canonical section labels produced by the section detector.
 */
public enum SectionLabel {
    WARMUP("Warmup"),
    PRE_SET("Pre-Set"),
    MAIN_SET("Main Set"),
    POST_SET("Post-Set / Technique"),
    COOLDOWN("Cooldown");

    private final String displayName;

    SectionLabel(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
