package io.swimset.workout.config;

import io.swimset.workout.cli.CliArguments;
import io.swimset.workout.model.SectionLabel;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 * CLI values win over environment values, which win over defaults.
 */
public class ConfigLoader {

    static final String ENV_OUTPUT_FORMAT = "WORKOUT_OUTPUT_FORMAT";
    static final String ENV_DEFAULT_SECTION = "WORKOUT_DEFAULT_SECTION";
    static final String ENV_POOL_INFO = "WORKOUT_POOL_INFO";
    static final String ENV_FAIL_ON_WARNINGS = "WORKOUT_FAIL_ON_WARNINGS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_SECTION_LABEL = SectionLabel.MAIN_SET.displayName();

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        OutputFormat outputFormat = resolveOutputFormat(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        String defaultSectionLabel = firstNonBlank(arguments.defaultSection(), ENV_DEFAULT_SECTION, DEFAULT_SECTION_LABEL);
        Optional<String> poolInfo = Optional.ofNullable(arguments.poolInfo())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.getNonBlank(ENV_POOL_INFO));
        Optional<String> titleOverride = Optional.ofNullable(arguments.title()).filter(ConfigLoader::isNotBlank);
        boolean failOnWarnings = resolveFailOnWarnings(arguments);

        return new Config(arguments.inputs(), outputFormat, logFormat, defaultSectionLabel,
                titleOverride, poolInfo, failOnWarnings, arguments.verbose());
    }

    private OutputFormat resolveOutputFormat(CliArguments arguments) {
        OutputFormat cliFormat = arguments.outputFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_OUTPUT_FORMAT)
                .map(OutputFormat::from)
                .orElse(OutputFormat.TEXT);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveFailOnWarnings(CliArguments arguments) {
        if (arguments.failOnWarnings()) {
            return true;
        }
        return environmentReader.getNonBlank(ENV_FAIL_ON_WARNINGS)
                .map(ConfigLoader::parseBoolean)
                .orElse(false);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.getNonBlank(envKey).orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean parseBoolean(String raw) {
        String value = raw.toLowerCase(Locale.ROOT);
        if (value.equals("true") || value.equals("1") || value.equals("yes")) {
            return true;
        }
        if (value.equals("false") || value.equals("0") || value.equals("no")) {
            return false;
        }
        throw new IllegalArgumentException(ENV_FAIL_ON_WARNINGS + " must be true or false: " + raw);
    }
}
