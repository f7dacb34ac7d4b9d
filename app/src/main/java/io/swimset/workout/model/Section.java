package io.swimset.workout.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Ordered part of a workout such as "Warmup" or "Main Set".
 */
public record Section(UUID id, String label, List<WorkoutSet> sets) {

    public Section {
        Objects.requireNonNull(id, "id");
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label must not be blank");
        }
        sets = sets == null ? List.of() : List.copyOf(sets);
    }

    public static Section open(String label) {
        return new Section(UUID.randomUUID(), label, List.of());
    }

    public boolean isEmpty() {
        return sets.isEmpty();
    }

    public int yardage() {
        return Yardage.saturate(sets.stream().mapToLong(WorkoutSet::yardage).sum());
    }

    public Section append(WorkoutSet set) {
        List<WorkoutSet> updated = new ArrayList<>(sets);
        updated.add(Objects.requireNonNull(set, "set"));
        return new Section(id, label, updated);
    }

    public Optional<WorkoutSet> lastSet() {
        return sets.isEmpty() ? Optional.empty() : Optional.of(sets.get(sets.size() - 1));
    }

    public Section withLastSet(WorkoutSet replacement) {
        if (sets.isEmpty()) {
            throw new IllegalStateException("Section has no sets to replace");
        }
        List<WorkoutSet> updated = new ArrayList<>(sets);
        updated.set(updated.size() - 1, replacement);
        return new Section(id, label, updated);
    }
}
