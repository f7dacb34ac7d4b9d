package io.swimset.workout.config;

/**
 * How a parsed workout is written to standard output.
 */
public enum OutputFormat {
    /** Commit-style workout text. */
    TEXT,
    /** Structured JSON document. */
    JSON,
    /** Yardage totals and warnings. */
    SUMMARY;

    public static OutputFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TEXT;
        }
        for (OutputFormat format : values()) {
            if (format.name().equalsIgnoreCase(raw.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported output format: " + raw);
    }
}
