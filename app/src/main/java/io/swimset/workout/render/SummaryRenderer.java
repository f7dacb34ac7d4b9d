package io.swimset.workout.render;

import io.swimset.workout.model.Effort;
import io.swimset.workout.model.ParseResult;
import io.swimset.workout.model.Section;
import io.swimset.workout.model.StrokeCategory;
import io.swimset.workout.model.Yardage;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Short yardage report: total, per section, per stroke and per effort, then warnings.
 */
public class SummaryRenderer {

    public String render(ParseResult result, Optional<String> titleOverride) {
        StringBuilder output = new StringBuilder();
        titleOverride.filter(value -> !value.isBlank()).or(result::title)
                .ifPresent(title -> output.append(title).append('\n'));
        output.append(String.format(Locale.ROOT, "Total: %,d (%d sets)\n", Yardage.total(result), Yardage.setCount(result)));
        for (Section section : result.sections()) {
            output.append(String.format(Locale.ROOT, "  %-22s %,7d\n", section.label(), section.yardage()));
        }
        Map<StrokeCategory, Integer> byStroke = Yardage.byStroke(result);
        if (!byStroke.isEmpty()) {
            output.append("By stroke:").append('\n');
            byStroke.forEach((category, yards) ->
                    output.append(String.format(Locale.ROOT, "  %-22s %,7d\n", category.displayName(), yards)));
        }
        Map<Effort, Integer> byEffort = Yardage.byEffort(result);
        if (!byEffort.isEmpty()) {
            output.append("By effort:").append('\n');
            byEffort.forEach((effort, yards) -> output.append(
                    String.format(Locale.ROOT, "  %-9s %-18s %,7d\n", effort.code(), effort.label(), yards)));
        }
        for (String warning : result.warnings()) {
            output.append("Warning: ").append(warning).append('\n');
        }
        return output.toString();
    }
}
