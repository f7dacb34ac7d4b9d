package io.swimset.workout.parse.extract;

import java.util.regex.Pattern;

/**
 * Leading hyphen or en-dash marking a bullet or a descriptor line.
 */
public final class DashPrefix {

    private static final Pattern PREFIX = Pattern.compile("^[–-]\\s*");

    private DashPrefix() {
    }

    public static boolean startsWithDash(String trimmed) {
        return trimmed.startsWith("-") || trimmed.startsWith("–");
    }

    public static String strip(String trimmed) {
        return PREFIX.matcher(trimmed).replaceFirst("");
    }
}
