package io.swimset.workout.parse.extract;

import io.swimset.workout.model.Effort;
import io.swimset.workout.model.Stroke;
import io.swimset.workout.model.SwimMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whole-word keyword lookup over a table of values. The first keyword in table order that occurs in
 * the text wins, and only its first occurrence is removed ("swimmer" never matches "swim").
 */
public final class KeywordExtractor<T> {

    private final List<Entry<T>> entries;

    private KeywordExtractor(List<Entry<T>> entries) {
        this.entries = List.copyOf(entries);
    }

    public static KeywordExtractor<Stroke> strokes() {
        return of(List.of(Stroke.values()), Stroke::keywords);
    }

    public static KeywordExtractor<SwimMode> modes() {
        return of(List.of(SwimMode.values()), SwimMode::keywords);
    }

    public static KeywordExtractor<Effort> efforts() {
        return of(List.of(Effort.values()), Effort::keywords);
    }

    static <T> KeywordExtractor<T> of(List<T> values, Function<T, List<String>> keywords) {
        List<Entry<T>> entries = new ArrayList<>();
        for (T value : values) {
            for (String keyword : keywords.apply(value)) {
                entries.add(new Entry<>(wholeWord(keyword), value));
            }
        }
        return new KeywordExtractor<>(entries);
    }

    public Extraction<T> extract(String text) {
        Objects.requireNonNull(text, "text");
        for (Entry<T> entry : entries) {
            Matcher matcher = entry.pattern().matcher(text);
            if (matcher.find()) {
                return Extraction.found(entry.value(), TextCuts.cut(text, matcher));
            }
        }
        return Extraction.none(text);
    }

    private static Pattern wholeWord(String keyword) {
        String body = Pattern.quote(keyword).replace(" ", "\\E\\s+\\Q");
        return Pattern.compile("\\b" + body + "\\b", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private record Entry<T>(Pattern pattern, T value) {
    }
}
