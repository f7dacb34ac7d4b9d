package io.swimset.workout.parse;

import io.swimset.workout.model.SectionLabel;

/**
 * Caller-supplied parser settings.
 *
 * @param defaultSectionLabel label of the section opened for content that appears before any header
 */
public record ParserOptions(String defaultSectionLabel) {

    public ParserOptions {
        if (defaultSectionLabel == null || defaultSectionLabel.isBlank()) {
            throw new IllegalArgumentException("defaultSectionLabel must not be blank");
        }
        defaultSectionLabel = defaultSectionLabel.strip();
    }

    public static ParserOptions defaults() {
        return new ParserOptions(SectionLabel.MAIN_SET.displayName());
    }
}
