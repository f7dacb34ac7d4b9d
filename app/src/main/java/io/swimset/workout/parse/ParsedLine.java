package io.swimset.workout.parse;

import io.swimset.workout.model.WorkoutLine;
import io.swimset.workout.model.WorkoutSet;
import java.util.Objects;

/**
 * Output of the line parser: a one-line set plus whether the source line started with a dash.
 *
 * @param set            set holding exactly one line, {@code repeatCount == 1}
 * @param startedWithDash whether the line carried a {@code -} or {@code –} bullet
 * @param strippedText   the line with its bullet removed, used when the line is merged as a descriptor
 */
public record ParsedLine(WorkoutSet set, boolean startedWithDash, String strippedText) {

    public ParsedLine {
        Objects.requireNonNull(set, "set");
        Objects.requireNonNull(strippedText, "strippedText");
        if (set.lines().size() != 1 || set.repeatCount() != 1) {
            throw new IllegalArgumentException("Parsed line must hold exactly one line with repeatCount 1");
        }
    }

    public WorkoutLine line() {
        return set.lines().get(0);
    }

    public boolean hasNumericData() {
        return line().hasNumericData();
    }

    /**
     * A dash-prefixed line without reps or distance annotates the previous line instead of starting
     * a new one.
     */
    public boolean isDescriptor() {
        return startedWithDash && !hasNumericData();
    }
}
