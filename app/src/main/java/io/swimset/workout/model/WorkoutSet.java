package io.swimset.workout.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One block of the page: a group of lines swum {@code repeatCount} times.
 */
public record WorkoutSet(UUID id, Optional<String> title, int repeatCount, List<WorkoutLine> lines) {

    public WorkoutSet {
        Objects.requireNonNull(id, "id");
        title = title == null ? Optional.empty() : title;
        if (repeatCount < 1) {
            throw new IllegalArgumentException("repeatCount must be at least 1");
        }
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public static WorkoutSet single(WorkoutLine line) {
        return new WorkoutSet(UUID.randomUUID(), Optional.empty(), 1, List.of(line));
    }

    public static WorkoutSet repeated(int repeatCount, List<WorkoutLine> lines) {
        return new WorkoutSet(UUID.randomUUID(), Optional.empty(), repeatCount, lines);
    }

    public int yardage() {
        long perPass = Yardage.saturate(lines.stream().mapToLong(WorkoutLine::yardage).sum());
        return Yardage.saturate(perPass * repeatCount);
    }

    public Optional<WorkoutLine> lastLine() {
        return lines.isEmpty() ? Optional.empty() : Optional.of(lines.get(lines.size() - 1));
    }

    public WorkoutSet withLastLine(WorkoutLine replacement) {
        if (lines.isEmpty()) {
            throw new IllegalStateException("Set has no lines to replace");
        }
        List<WorkoutLine> updated = new ArrayList<>(lines);
        updated.set(updated.size() - 1, replacement);
        return new WorkoutSet(id, title, repeatCount, updated);
    }
}
