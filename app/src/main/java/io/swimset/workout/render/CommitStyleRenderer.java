package io.swimset.workout.render;

import io.swimset.workout.model.IntervalKind;
import io.swimset.workout.model.ParseResult;
import io.swimset.workout.model.Section;
import io.swimset.workout.model.WorkoutLine;
import io.swimset.workout.model.WorkoutSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders a parsed workout as plain "commit-style" text, the form printed on a practice sheet.
 * The output is itself valid workout text: repeated blocks are written as {@code N rounds of:}
 * followed by indented lines, so parsing it again keeps the total yardage.
 */
public class CommitStyleRenderer {

    private static final String GROUP_INDENT = "  ";

    public String render(ParseResult result) {
        return render(result, Optional.empty(), Optional.empty());
    }

    public String render(ParseResult result, Optional<String> titleOverride, Optional<String> poolInfo) {
        StringBuilder output = new StringBuilder();
        Optional<String> title = titleOverride.filter(value -> !value.isBlank()).or(result::title);
        title.ifPresent(value -> {
            output.append(value);
            poolInfo.filter(info -> !info.isBlank()).ifPresent(info -> output.append(" | ").append(info));
            output.append('\n').append('\n');
        });

        for (Section section : result.sections()) {
            output.append(section.label()).append('\n');
            for (WorkoutSet set : section.sets()) {
                set.title().filter(value -> !value.isBlank()).ifPresent(value -> output.append(value).append('\n'));
                String indent = "";
                if (set.repeatCount() > 1) {
                    output.append(set.repeatCount()).append(" rounds of:").append('\n');
                    indent = GROUP_INDENT;
                }
                for (WorkoutLine line : set.lines()) {
                    output.append(indent).append(renderLine(line)).append('\n');
                }
            }
            output.append('\n');
        }
        return output.toString();
    }

    public String renderLine(WorkoutLine line) {
        List<String> parts = new ArrayList<>();
        line.distance().ifPresent(distance -> {
            int reps = line.reps().orElse(1);
            parts.add(reps > 1 ? reps + "x" + distance : String.valueOf(distance));
        });
        line.stroke().ifPresent(stroke -> parts.add(stroke.keyword()));
        line.mode().ifPresent(mode -> parts.add(mode.keyword()));
        line.effort().ifPresent(effort -> parts.add(effort.keyword()));
        if (!line.text().isBlank()) {
            parts.add(line.text());
        }
        line.intervalSeconds().ifPresent(seconds -> {
            if (line.intervalKind() == IntervalKind.REST) {
                parts.add(IntervalFormatter.format(seconds) + " rest");
            } else if (line.intervalKind() == IntervalKind.SENDOFF) {
                parts.add("@ " + IntervalFormatter.format(seconds));
            }
        });
        return String.join(" ", parts);
    }
}
