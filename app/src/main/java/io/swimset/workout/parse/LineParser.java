package io.swimset.workout.parse;

import io.swimset.workout.model.Effort;
import io.swimset.workout.model.Stroke;
import io.swimset.workout.model.SwimMode;
import io.swimset.workout.model.WorkoutLine;
import io.swimset.workout.model.WorkoutSet;
import io.swimset.workout.parse.extract.DashPrefix;
import io.swimset.workout.parse.extract.Extraction;
import io.swimset.workout.parse.extract.Interval;
import io.swimset.workout.parse.extract.IntervalExtractor;
import io.swimset.workout.parse.extract.KeywordExtractor;
import io.swimset.workout.parse.extract.LabelStripper;
import io.swimset.workout.parse.extract.ParentheticalNoteExtractor;
import io.swimset.workout.parse.extract.RepsDistance;
import io.swimset.workout.parse.extract.RepsDistanceExtractor;
import io.swimset.workout.parse.extract.TotalExtractor;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns one physical line into a one-line {@link WorkoutSet}. Never fails: a line with no
 * recognizable numbers becomes a text-only line holding the whole input.
 */
public class LineParser {

    private static final Pattern EDGE_SEPARATORS = Pattern.compile("^[–-]\\s*|\\s*[–-]$|^,\\s*|\\s*,$");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private final LabelStripper labelStripper = new LabelStripper();
    private final ParentheticalNoteExtractor noteExtractor = new ParentheticalNoteExtractor();
    private final RepsDistanceExtractor repsDistanceExtractor = new RepsDistanceExtractor();
    private final KeywordExtractor<Stroke> strokeExtractor = KeywordExtractor.strokes();
    private final KeywordExtractor<SwimMode> modeExtractor = KeywordExtractor.modes();
    private final IntervalExtractor intervalExtractor = new IntervalExtractor();
    private final KeywordExtractor<Effort> effortExtractor = KeywordExtractor.efforts();
    private final TotalExtractor totalExtractor = new TotalExtractor();

    public ParsedLine parseLine(String rawLine) {
        String trimmed = rawLine == null ? "" : rawLine.strip();
        boolean startedWithDash = DashPrefix.startsWithDash(trimmed);
        String line = startedWithDash ? DashPrefix.strip(trimmed) : trimmed;
        return new ParsedLine(WorkoutSet.single(parseContent(line)), startedWithDash, line);
    }

    private WorkoutLine parseContent(String line) {
        String remainder = labelStripper.strip(line).strip();

        Extraction<RepsDistance> repsDistance = repsDistanceExtractor.extractNested(remainder);
        String notes;
        if (repsDistance.isPresent()) {
            Extraction<String> noteExtraction = noteExtractor.extract(repsDistance.remainder());
            notes = noteExtraction.value().orElse("");
            remainder = noteExtraction.remainder();
        } else {
            Extraction<String> noteExtraction = noteExtractor.extract(remainder);
            notes = noteExtraction.value().orElse("");
            repsDistance = repsDistanceExtractor.extract(noteExtraction.remainder().strip());
            remainder = repsDistance.remainder();
        }

        if (!repsDistance.isPresent()) {
            return totalOrText(line);
        }
        return describe(repsDistance.value().get(), remainder, notes);
    }

    private WorkoutLine describe(RepsDistance repsDistance, String remainder, String notes) {
        Extraction<Stroke> stroke = strokeExtractor.extract(remainder);
        Extraction<SwimMode> mode = modeExtractor.extract(stroke.remainder());
        Extraction<Interval> interval = intervalExtractor.extract(mode.remainder());
        Extraction<Effort> effort = effortExtractor.extract(interval.remainder());

        String text = tidy(effort.remainder());
        if (isRepeatOf(text, stroke.value().map(Stroke::keywords))
                || isRepeatOf(text, mode.value().map(SwimMode::keywords))) {
            text = "";
        }
        if (!notes.isEmpty()) {
            text = text.isEmpty() ? notes : text + " " + notes;
        }

        WorkoutLine.Builder builder = WorkoutLine.builder()
                .reps(repsDistance.reps())
                .distance(repsDistance.distance())
                .stroke(stroke.value().orElse(null))
                .mode(mode.value().orElse(null))
                .effort(effort.value().orElse(null))
                .text(text);
        interval.value().ifPresent(value -> builder.interval(value.seconds(), value.kind()));
        return builder.build();
    }

    private WorkoutLine totalOrText(String line) {
        Extraction<Integer> total = totalExtractor.extract(labelStripper.strip(line).strip());
        if (total.isPresent()) {
            return WorkoutLine.builder()
                    .reps(1)
                    .distance(total.value().get())
                    .text(tidy(total.remainder()))
                    .build();
        }
        return WorkoutLine.textOnly(line);
    }

    private static String tidy(String text) {
        String collapsed = WHITESPACE_RUN.matcher(text.strip()).replaceAll(" ");
        return EDGE_SEPARATORS.matcher(collapsed).replaceAll("").strip();
    }

    private static boolean isRepeatOf(String text, Optional<List<String>> keywords) {
        return !text.isEmpty() && keywords.map(words -> words.contains(text.toLowerCase(Locale.ROOT))).orElse(false);
    }
}
