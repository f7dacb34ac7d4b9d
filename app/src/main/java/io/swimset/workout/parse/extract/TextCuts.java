package io.swimset.workout.parse.extract;

import java.util.OptionalInt;
import java.util.regex.Matcher;

final class TextCuts {

    private TextCuts() {
    }

    /**
     * Removes the current match of {@code matcher} from {@code text}.
     */
    static String cut(String text, Matcher matcher) {
        return text.substring(0, matcher.start()) + text.substring(matcher.end());
    }

    /**
     * Parses a digit run; empty when it does not fit in an int.
     */
    static OptionalInt parseInt(String digits) {
        if (digits == null || digits.isEmpty()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(digits));
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }
}
