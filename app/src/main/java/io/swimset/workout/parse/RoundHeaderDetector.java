package io.swimset.workout.parse;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects repeat-block headers: {@code 2x thru}, {@code 3 rounds}, {@code 4x:}.
 * A set line such as {@code 4x100 free} is not a header, nor is a clock time like {@code 1:00 rest}.
 */
public class RoundHeaderDetector {

    private static final Pattern ROUND_HEADER = Pattern.compile(
            "^(\\d+)\\s*(?:x|×)?\\s*(?:rounds?|through|thru|:(?!\\d))", Pattern.CASE_INSENSITIVE);

    public OptionalInt extractRoundCount(String line) {
        if (line == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = ROUND_HEADER.matcher(line.strip());
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        try {
            int count = Integer.parseInt(matcher.group(1));
            return count >= 1 ? OptionalInt.of(count) : OptionalInt.empty();
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }
}
