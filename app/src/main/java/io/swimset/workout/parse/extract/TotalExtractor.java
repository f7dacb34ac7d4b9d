package io.swimset.workout.parse.extract;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes yardage-only lines such as {@code Total: 600} or a lone {@code 1500}.
 */
public final class TotalExtractor {

    private static final Pattern LABELLED = Pattern.compile("(?:total|preset|warmup|cooldown):\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE = Pattern.compile("^(\\d{3,})\\s*$");

    public Extraction<Integer> extract(String text) {
        for (Pattern pattern : new Pattern[] {LABELLED, BARE}) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                OptionalInt yards = TextCuts.parseInt(matcher.group(1));
                if (yards.isPresent()) {
                    return Extraction.found(yards.getAsInt(), TextCuts.cut(text, matcher));
                }
            }
        }
        return Extraction.none(text);
    }
}
