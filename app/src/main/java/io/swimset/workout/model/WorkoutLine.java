package io.swimset.workout.model;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One typed line of a workout, e.g. {@code 4x100 free @ 1:30 descend}.
 * A line without reps and distance is a text-only line carrying free-form notes.
 */
public record WorkoutLine(
        UUID id,
        Optional<Integer> reps,
        Optional<Integer> distance,
        Optional<Stroke> stroke,
        Optional<SwimMode> mode,
        Optional<Integer> intervalSeconds,
        IntervalKind intervalKind,
        Optional<Effort> effort,
        String text
) {

    public WorkoutLine {
        Objects.requireNonNull(id, "id");
        reps = reps == null ? Optional.empty() : reps;
        distance = distance == null ? Optional.empty() : distance;
        stroke = stroke == null ? Optional.empty() : stroke;
        mode = mode == null ? Optional.empty() : mode;
        intervalSeconds = intervalSeconds == null ? Optional.empty() : intervalSeconds;
        intervalKind = intervalKind == null ? IntervalKind.NONE : intervalKind;
        effort = effort == null ? Optional.empty() : effort;
        text = text == null ? "" : text;
        if (reps.isPresent() && reps.get() < 1) {
            throw new IllegalArgumentException("reps must be positive");
        }
        if (distance.isPresent() && distance.get() < 0) {
            throw new IllegalArgumentException("distance must not be negative");
        }
        if (intervalSeconds.isPresent() && intervalSeconds.get() < 0) {
            throw new IllegalArgumentException("intervalSeconds must not be negative");
        }
    }

    public static WorkoutLine textOnly(String text) {
        return builder().text(text).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasNumericData() {
        return reps.isPresent() || distance.isPresent();
    }

    /**
     * Yardage of a single pass through this line: distance times reps, reps defaulting to one.
     * Capped at {@link Integer#MAX_VALUE}.
     */
    public int yardage() {
        return distance.map(value -> Yardage.saturate((long) value * reps.orElse(1))).orElse(0);
    }

    public WorkoutLine withText(String newText) {
        return new WorkoutLine(id, reps, distance, stroke, mode, intervalSeconds, intervalKind, effort, newText);
    }

    /**
     * Appends a note to the free text, separated by a single space.
     */
    public WorkoutLine appendText(String note) {
        if (note == null || note.isBlank()) {
            return this;
        }
        return withText(text.isEmpty() ? note : text + " " + note);
    }

    public static final class Builder {

        private UUID id = UUID.randomUUID();
        private Integer reps;
        private Integer distance;
        private Stroke stroke;
        private SwimMode mode;
        private Integer intervalSeconds;
        private IntervalKind intervalKind = IntervalKind.NONE;
        private Effort effort;
        private String text = "";

        private Builder() {
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder reps(Integer reps) {
            this.reps = reps;
            return this;
        }

        public Builder distance(Integer distance) {
            this.distance = distance;
            return this;
        }

        public Builder stroke(Stroke stroke) {
            this.stroke = stroke;
            return this;
        }

        public Builder mode(SwimMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder interval(Integer seconds, IntervalKind kind) {
            this.intervalSeconds = seconds;
            this.intervalKind = kind;
            return this;
        }

        public Builder effort(Effort effort) {
            this.effort = effort;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public WorkoutLine build() {
            return new WorkoutLine(id,
                    Optional.ofNullable(reps),
                    Optional.ofNullable(distance),
                    Optional.ofNullable(stroke),
                    Optional.ofNullable(mode),
                    Optional.ofNullable(intervalSeconds),
                    intervalKind,
                    Optional.ofNullable(effort),
                    text);
        }
    }
}
