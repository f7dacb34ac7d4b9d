package io.swimset.workout.parse.extract;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of running one extractor over the remaining text of a line: the extracted value, if any,
 * and the text left for the next extractor.
 */
public record Extraction<T>(Optional<T> value, String remainder) {

    public Extraction {
        value = value == null ? Optional.empty() : value;
        Objects.requireNonNull(remainder, "remainder");
    }

    public static <T> Extraction<T> found(T value, String remainder) {
        return new Extraction<>(Optional.of(value), remainder);
    }

    public static <T> Extraction<T> none(String remainder) {
        return new Extraction<>(Optional.empty(), remainder);
    }

    public boolean isPresent() {
        return value.isPresent();
    }
}
