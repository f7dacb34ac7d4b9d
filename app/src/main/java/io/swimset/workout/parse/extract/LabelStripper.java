package io.swimset.workout.parse.extract;

import java.util.regex.Pattern;

/**
 * Drops list labels such as {@code "A. "} or {@code "1-2: "} from the start of a line.
 */
public final class LabelStripper {

    private static final Pattern LABEL = Pattern.compile("^[A-Z]\\.\\s*|^\\d+[–-]\\d+:\\s*");

    public String strip(String text) {
        return LABEL.matcher(text).replaceFirst("");
    }
}
