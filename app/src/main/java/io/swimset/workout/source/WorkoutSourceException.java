package io.swimset.workout.source;

/**
 * Runtime exception raised when workout text cannot be read.
 */
public class WorkoutSourceException extends RuntimeException {

    public WorkoutSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
