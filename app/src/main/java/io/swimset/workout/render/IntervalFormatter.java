package io.swimset.workout.render;

import java.util.Locale;

/**
 * Formats interval seconds the way coaches write them: {@code :50}, {@code 1:30}, {@code 12:05}.
 */
public final class IntervalFormatter {

    private IntervalFormatter() {
    }

    public static String format(int seconds) {
        if (seconds <= 0) {
            return ":00";
        }
        int minutes = seconds / 60;
        int remainder = seconds % 60;
        if (minutes == 0) {
            return String.format(Locale.ROOT, ":%02d", remainder);
        }
        return String.format(Locale.ROOT, "%d:%02d", minutes, remainder);
    }
}
