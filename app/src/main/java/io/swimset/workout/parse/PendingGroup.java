package io.swimset.workout.parse;

import io.swimset.workout.model.WorkoutLine;
import io.swimset.workout.model.WorkoutSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Repeat-block buffer. Idle is a count of one with no lines; a round header moves it to
 * accumulating, and indented lines are collected until the block is flushed as one repeated set.
 */
public record PendingGroup(int repeatCount, List<WorkoutLine> lines) {

    private static final PendingGroup IDLE = new PendingGroup(1, List.of());

    public PendingGroup {
        if (repeatCount < 1) {
            throw new IllegalArgumentException("repeatCount must be at least 1");
        }
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public static PendingGroup idle() {
        return IDLE;
    }

    public static PendingGroup accumulating(int repeatCount) {
        return new PendingGroup(repeatCount, List.of());
    }

    public boolean isAccumulating() {
        return repeatCount > 1;
    }

    public PendingGroup append(WorkoutLine line) {
        List<WorkoutLine> updated = new ArrayList<>(lines);
        updated.add(line);
        return new PendingGroup(repeatCount, updated);
    }

    public PendingGroup withLastLine(WorkoutLine line) {
        if (lines.isEmpty()) {
            throw new IllegalStateException("Group has no lines to replace");
        }
        List<WorkoutLine> updated = new ArrayList<>(lines);
        updated.set(updated.size() - 1, line);
        return new PendingGroup(repeatCount, updated);
    }

    public Optional<WorkoutLine> lastLine() {
        return lines.isEmpty() ? Optional.empty() : Optional.of(lines.get(lines.size() - 1));
    }

    /**
     * The buffered lines as one set; empty when nothing was collected.
     */
    public Optional<WorkoutSet> toSet() {
        if (lines.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(WorkoutSet.repeated(repeatCount, lines));
    }
}
