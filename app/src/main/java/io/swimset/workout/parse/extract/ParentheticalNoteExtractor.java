package io.swimset.workout.parse.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls every {@code (...)} note out of the text so the numeric extractors see clean input.
 * The notes come back joined with {@code ", "} in their original order.
 */
public final class ParentheticalNoteExtractor {

    private static final Pattern NOTE = Pattern.compile("\\(([^)]+)\\)");

    public Extraction<String> extract(String text) {
        Matcher matcher = NOTE.matcher(text);
        List<String> notes = new ArrayList<>();
        StringBuilder remainder = new StringBuilder(text.length());
        int last = 0;
        while (matcher.find()) {
            notes.add(matcher.group(1).trim());
            remainder.append(text, last, matcher.start());
            last = matcher.end();
        }
        if (notes.isEmpty()) {
            return Extraction.none(text);
        }
        remainder.append(text.substring(last));
        return Extraction.found(String.join(", ", notes), remainder.toString());
    }
}
