package io.swimset.workout.parse.extract;

import io.swimset.workout.model.IntervalKind;
import java.util.Objects;

/**
 * Interval read from a line, in seconds.
 */
public record Interval(int seconds, IntervalKind kind) {

    public Interval {
        Objects.requireNonNull(kind, "kind");
        if (seconds < 0) {
            throw new IllegalArgumentException("seconds must not be negative");
        }
    }
}
