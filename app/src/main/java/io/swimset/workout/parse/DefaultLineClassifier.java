package io.swimset.workout.parse;

import io.swimset.workout.model.SectionLabel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Default classification: blank, then comment ({@code //} or {@code #}), then section header, then
 * round header; everything else is content.
 */
public class DefaultLineClassifier implements LineClassifier {

    private final SectionDetector sectionDetector;
    private final RoundHeaderDetector roundHeaderDetector;

    public DefaultLineClassifier() {
        this(new SectionDetector(), new RoundHeaderDetector());
    }

    public DefaultLineClassifier(SectionDetector sectionDetector, RoundHeaderDetector roundHeaderDetector) {
        this.sectionDetector = sectionDetector;
        this.roundHeaderDetector = roundHeaderDetector;
    }

    @Override
    public List<ClassifiedLine> classify(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return Collections.emptyList();
        }
        List<ClassifiedLine> classified = new ArrayList<>(lines.size());
        for (String line : lines) {
            classified.add(classify(line == null ? "" : line));
        }
        return classified;
    }

    ClassifiedLine classify(String raw) {
        String trimmed = raw.strip();
        boolean indented = !raw.isEmpty() && Character.isWhitespace(raw.charAt(0));
        if (trimmed.isEmpty()) {
            return new ClassifiedLine(LineKind.BLANK, raw, trimmed, indented, Optional.empty(), 0);
        }
        if (trimmed.startsWith("//") || trimmed.startsWith("#")) {
            return new ClassifiedLine(LineKind.COMMENT, raw, trimmed, indented, Optional.empty(), 0);
        }
        Optional<SectionLabel> section = sectionDetector.detect(trimmed);
        if (section.isPresent()) {
            return new ClassifiedLine(LineKind.SECTION_HEADER, raw, trimmed, indented, section, 0);
        }
        OptionalInt rounds = roundHeaderDetector.extractRoundCount(trimmed);
        if (rounds.isPresent()) {
            return new ClassifiedLine(LineKind.ROUND_HEADER, raw, trimmed, indented, Optional.empty(), rounds.getAsInt());
        }
        return new ClassifiedLine(LineKind.CONTENT, raw, trimmed, indented, Optional.empty(), 0);
    }
}
