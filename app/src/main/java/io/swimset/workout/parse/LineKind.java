package io.swimset.workout.parse;

/**
 * Classification of physical workout lines.
 */
public enum LineKind {
    BLANK,
    COMMENT,
    SECTION_HEADER,
    ROUND_HEADER,
    CONTENT
}
