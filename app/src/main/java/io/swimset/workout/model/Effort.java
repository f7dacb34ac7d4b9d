package io.swimset.workout.model;

import java.util.List;

/**
 * Named pace patterns a coach attaches to a line.
 */
public enum Effort {
    EASY("Easy (EZ)", "EZ", List.of("easy", "ez")),
    CRUISE("Cruise", "Cruise", List.of("aerobic", "cruise")),
    MODERATE("Moderate / Strong", "Mod", List.of("moderate", "strong")),
    THRESHOLD("Threshold", "Threshold", List.of("threshold")),
    RACE_PACE("Race pace", "Race pace", List.of("race pace", "race")),
    SPRINT("Sprint / All-out", "Sp", List.of("sprint")),
    FAST("Fast", "Fast", List.of("fast")),
    DESCEND("Descend", "DESC", List.of("descend", "desc")),
    ASCEND("Ascend", "ASC", List.of("ascend")),
    BUILD("Build", "Bld", List.of("build")),
    NEGATIVE_SPLIT("Negative split", "N/S", List.of("negative split")),
    EVEN_PACE("Even pace", "Even", List.of("even pace")),
    BEST_AVERAGE("Best average", "Best avg", List.of("best average")),
    HOLD_PACE("Hold pace", "Hold", List.of("hold pace"));

    private final String label;
    private final String code;
    private final List<String> keywords;

    Effort(String label, String code, List<String> keywords) {
        this.label = label;
        this.code = code;
        this.keywords = keywords;
    }

    public String label() {
        return label;
    }

    /**
     * Short code used on printed sheets.
     */
    public String code() {
        return code;
    }

    public List<String> keywords() {
        return keywords;
    }

    /**
     * Canonical word written back into workout text; always recognized again when re-parsed.
     */
    public String keyword() {
        return keywords.get(0);
    }
}
