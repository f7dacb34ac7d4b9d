package io.swimset.workout.parse.extract;

/**
 * Reps and distance read from the start of a line.
 */
public record RepsDistance(int reps, int distance) {

    public RepsDistance {
        if (reps < 1) {
            throw new IllegalArgumentException("reps must be positive");
        }
        if (distance < 0) {
            throw new IllegalArgumentException("distance must not be negative");
        }
    }
}
