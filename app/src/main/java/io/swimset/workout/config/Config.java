package io.swimset.workout.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 *
 * @param inputs              workout files to parse; empty means standard input
 * @param outputFormat        how results are printed
 * @param logFormat           log encoder format
 * @param defaultSectionLabel label for content that appears before any section header
 * @param titleOverride       title printed instead of the parsed one
 * @param poolInfo            pool description appended to the printed title, e.g. "25 Yards"
 * @param failOnWarnings      whether parse warnings make the run fail
 * @param verbose             whether debug logging is enabled
 */
public record Config(
        List<Path> inputs,
        OutputFormat outputFormat,
        LogFormat logFormat,
        String defaultSectionLabel,
        Optional<String> titleOverride,
        Optional<String> poolInfo,
        boolean failOnWarnings,
        boolean verbose
) {

    public Config {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        Objects.requireNonNull(outputFormat, "outputFormat");
        Objects.requireNonNull(logFormat, "logFormat");
        defaultSectionLabel = requireNonBlank(defaultSectionLabel, "defaultSectionLabel");
        titleOverride = normalize(titleOverride);
        poolInfo = normalize(poolInfo);
    }

    public boolean readsStdin() {
        return inputs.isEmpty();
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }

    private static Optional<String> normalize(Optional<String> value) {
        return value == null ? Optional.empty() : value.map(String::trim).filter(text -> !text.isEmpty());
    }
}
