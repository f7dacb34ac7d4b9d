package io.swimset.workout.model;

import java.util.List;
import java.util.Locale;

/**
 * Activity modifier of a line, orthogonal to the stroke.
 */
public enum SwimMode implements StrokeCategory {
    SWIM("Swim", List.of("swim")),
    KICK("Kick", List.of("kick")),
    PULL("Pull", List.of("pull")),
    DRILL("Drill", List.of("drill", "drills")),
    SCULL("Scull", List.of("scull")),
    TECHNIQUE("Technique", List.of("technique"));

    private final String displayName;
    private final List<String> keywords;

    SwimMode(String displayName, List<String> keywords) {
        this.displayName = displayName;
        this.keywords = keywords;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    public List<String> keywords() {
        return keywords;
    }

    public String keyword() {
        return keywords.get(0);
    }

    public static SwimMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Mode must be provided");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (SwimMode mode : values()) {
            if (mode.keywords.contains(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    public static boolean isMode(String raw) {
        if (raw == null) {
            return false;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (SwimMode mode : values()) {
            if (mode.keywords.contains(value) || mode.name().equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
