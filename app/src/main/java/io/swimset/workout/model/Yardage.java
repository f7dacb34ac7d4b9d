package io.swimset.workout.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only yardage computations over a parsed workout.
 */
public final class Yardage {

    private Yardage() {
    }

    public static int total(ParseResult result) {
        return saturate(result.sections().stream().mapToLong(Section::yardage).sum());
    }

    public static int setCount(ParseResult result) {
        return result.sections().stream().mapToInt(section -> section.sets().size()).sum();
    }

    /**
     * Rolls yardage up per stroke or mode. A mode other than swim takes priority over the stroke
     * ("free drill" counts as drill, "free swim" as free); lines with neither are not counted.
     */
    public static Map<StrokeCategory, Integer> byStroke(ParseResult result) {
        Map<StrokeCategory, Integer> totals = new LinkedHashMap<>();
        for (Section section : result.sections()) {
            for (WorkoutSet set : section.sets()) {
                for (WorkoutLine line : set.lines()) {
                    int yards = saturate((long) line.yardage() * set.repeatCount());
                    categoryOf(line).ifPresent(category -> totals.merge(category, yards, Yardage::add));
                }
            }
        }
        return totals;
    }

    /**
     * Rolls yardage up per effort, in first-seen order; lines without an effort are not counted.
     */
    public static Map<Effort, Integer> byEffort(ParseResult result) {
        Map<Effort, Integer> totals = new LinkedHashMap<>();
        for (Section section : result.sections()) {
            for (WorkoutSet set : section.sets()) {
                for (WorkoutLine line : set.lines()) {
                    int yards = saturate((long) line.yardage() * set.repeatCount());
                    line.effort().ifPresent(effort -> totals.merge(effort, yards, Yardage::add));
                }
            }
        }
        return totals;
    }

    static int saturate(long yards) {
        return (int) Math.max(0, Math.min(yards, Integer.MAX_VALUE));
    }

    private static int add(int left, int right) {
        return saturate((long) left + right);
    }

    static Optional<StrokeCategory> categoryOf(WorkoutLine line) {
        Optional<SwimMode> mode = line.mode();
        Optional<Stroke> stroke = line.stroke();
        if (mode.isPresent() && stroke.isPresent()) {
            return Optional.of(mode.get() == SwimMode.SWIM ? stroke.get() : mode.get());
        }
        if (mode.isPresent()) {
            return Optional.of(mode.get());
        }
        return stroke.<StrokeCategory>map(value -> value);
    }
}
