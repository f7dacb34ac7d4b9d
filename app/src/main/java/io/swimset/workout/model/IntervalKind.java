package io.swimset.workout.model;

/**
 * How the interval of a line is meant: time between starts, or rest between repeats.
 */
public enum IntervalKind {
    SENDOFF,
    REST,
    NONE
}
