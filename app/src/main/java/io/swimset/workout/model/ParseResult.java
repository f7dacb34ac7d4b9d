package io.swimset.workout.model;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of parsing one workout text. Always usable; warnings are advisory.
 */
public record ParseResult(List<Section> sections, Optional<String> title, List<String> warnings) {

    public ParseResult {
        sections = sections == null ? List.of() : List.copyOf(sections);
        title = title == null ? Optional.empty() : title;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ParseResult empty() {
        return new ParseResult(List.of(), Optional.empty(), List.of());
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
