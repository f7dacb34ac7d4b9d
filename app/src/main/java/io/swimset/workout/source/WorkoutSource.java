package io.swimset.workout.source;

import java.util.Objects;

/**
 * Workout text together with where it came from.
 */
public record WorkoutSource(String name, String text) {

    public static final String STDIN_NAME = "<stdin>";

    public WorkoutSource {
        Objects.requireNonNull(name, "name");
        text = text == null ? "" : text;
    }
}
