package io.swimset.workout.parse.extract;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads reps and distance from the start of a line, trying in order:
 * <ol>
 *   <li>nested repeats {@code 3x (4x25} collapsed to {@code 12x25},</li>
 *   <li>{@code 4x100} or {@code 4 x 100},</li>
 *   <li>a bare leading distance such as {@code 200 ez}.</li>
 * </ol>
 * Zero reps, numbers that overflow an int and a total yardage (reps times distance) that overflows
 * an int are not accepted.
 */
public final class RepsDistanceExtractor {

    private static final Pattern NESTED = Pattern.compile("^(\\d+)\\s*[x×]\\s*\\(?\\s*(\\d+)\\s*[x×]\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SIMPLE = Pattern.compile("^(\\d+)\\s*[x×]\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DISTANCE_ONLY = Pattern.compile("^(\\d+)(?:\\s|$)");

    /**
     * Only the nested form; it has to run before parenthetical notes are removed because the inner
     * group is itself parenthesized.
     */
    public Extraction<RepsDistance> extractNested(String text) {
        Matcher matcher = NESTED.matcher(text);
        if (!matcher.find()) {
            return Extraction.none(text);
        }
        OptionalInt outer = TextCuts.parseInt(matcher.group(1));
        OptionalInt inner = TextCuts.parseInt(matcher.group(2));
        OptionalInt distance = TextCuts.parseInt(matcher.group(3));
        if (outer.isEmpty() || inner.isEmpty() || distance.isEmpty()) {
            return Extraction.none(text);
        }
        Optional<RepsDistance> value = repsDistance(multiply(outer.getAsInt(), inner.getAsInt()), distance);
        if (value.isEmpty()) {
            return Extraction.none(text);
        }
        return Extraction.found(value.get(), dropInnerCloseParen(text.substring(matcher.end())));
    }

    /**
     * Simple {@code AxB} form, then a bare distance.
     */
    public Extraction<RepsDistance> extract(String text) {
        Matcher simple = SIMPLE.matcher(text);
        if (simple.find()) {
            Optional<RepsDistance> value = repsDistance(TextCuts.parseInt(simple.group(1)), TextCuts.parseInt(simple.group(2)));
            if (value.isPresent()) {
                return Extraction.found(value.get(), text.substring(simple.end()));
            }
            return Extraction.none(text);
        }
        Matcher distanceOnly = DISTANCE_ONLY.matcher(text);
        if (distanceOnly.find()) {
            Optional<RepsDistance> value = repsDistance(OptionalInt.of(1), TextCuts.parseInt(distanceOnly.group(1)));
            if (value.isPresent()) {
                return Extraction.found(value.get(), text.substring(distanceOnly.end()));
            }
        }
        return Extraction.none(text);
    }

    private static Optional<RepsDistance> repsDistance(OptionalInt reps, OptionalInt distance) {
        if (reps.isEmpty() || distance.isEmpty() || reps.getAsInt() < 1) {
            return Optional.empty();
        }
        if ((long) reps.getAsInt() * distance.getAsInt() > Integer.MAX_VALUE) {
            return Optional.empty();
        }
        return Optional.of(new RepsDistance(reps.getAsInt(), distance.getAsInt()));
    }

    private static OptionalInt multiply(int outer, int inner) {
        try {
            return OptionalInt.of(Math.multiplyExact(outer, inner));
        } catch (ArithmeticException ex) {
            return OptionalInt.empty();
        }
    }

    // The first ")" without a matching "(" closes the nested group.
    private static String dropInnerCloseParen(String rest) {
        int depth = 0;
        for (int i = 0; i < rest.length(); i++) {
            char ch = rest.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                if (depth == 0) {
                    return rest.substring(0, i) + rest.substring(i + 1);
                }
                depth--;
            }
        }
        return rest;
    }
}
