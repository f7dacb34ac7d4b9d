package io.swimset.workout.parse;

import io.swimset.workout.model.SectionLabel;
import java.util.Objects;
import java.util.Optional;

/**
 * A physical line together with its classification.
 *
 * @param kind       what the line is
 * @param raw        the line exactly as written
 * @param trimmed    the line without surrounding whitespace
 * @param indented   whether the raw line starts with whitespace
 * @param section    the detected label, for section headers
 * @param roundCount the repeat count, for round headers; 0 otherwise
 */
public record ClassifiedLine(LineKind kind, String raw, String trimmed, boolean indented,
                             Optional<SectionLabel> section, int roundCount) {

    public ClassifiedLine {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(trimmed, "trimmed");
        section = section == null ? Optional.empty() : section;
        if (kind == LineKind.SECTION_HEADER && section.isEmpty()) {
            throw new IllegalArgumentException("Section header requires a label");
        }
        if (kind == LineKind.ROUND_HEADER && roundCount < 1) {
            throw new IllegalArgumentException("Round header requires a positive count");
        }
    }
}
