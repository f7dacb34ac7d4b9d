package io.swimset.workout.cli;

import io.swimset.workout.config.Config;
import io.swimset.workout.config.ConfigLoader;
import io.swimset.workout.config.EnvironmentReader;
import io.swimset.workout.logging.LoggingConfigurator;
import io.swimset.workout.model.ParseResult;
import io.swimset.workout.model.Yardage;
import io.swimset.workout.parse.ParserOptions;
import io.swimset.workout.parse.WorkoutParser;
import io.swimset.workout.render.CommitStyleRenderer;
import io.swimset.workout.render.ParseResultJsonWriter;
import io.swimset.workout.render.SummaryRenderer;
import io.swimset.workout.source.WorkoutSource;
import io.swimset.workout.source.WorkoutSourceException;
import io.swimset.workout.source.WorkoutSourceReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader, workout parser and renderers.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_WARNINGS = 1;
    static final int EXIT_UNREADABLE_INPUT = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final WorkoutSourceReader sourceReader;
    private final PrintWriter out;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new WorkoutSourceReader(),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, WorkoutSourceReader sourceReader, PrintWriter out) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.sourceReader = Objects.requireNonNull(sourceReader, "sourceReader");
        this.out = Objects.requireNonNull(out, "out");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.debug("Output format {} (default section '{}', inputs={})",
                config.outputFormat(), config.defaultSectionLabel(), config.readsStdin() ? "stdin" : config.inputs());

        List<WorkoutSource> sources;
        try {
            sources = sourceReader.read(config.inputs());
        } catch (WorkoutSourceException ex) {
            LOGGER.error("{}", ex.getMessage(), ex);
            return EXIT_UNREADABLE_INPUT;
        }

        WorkoutParser parser = new WorkoutParser(new ParserOptions(config.defaultSectionLabel()));
        boolean warned = false;
        for (WorkoutSource source : sources) {
            ParseResult result = parser.parse(source.text());
            LOGGER.info("Parsed {}: {} sections, {} total", source.name(), result.sections().size(), Yardage.total(result));
            for (String warning : result.warnings()) {
                LOGGER.warn("{}: {}", source.name(), warning);
            }
            warned |= result.hasWarnings();
            out.print(render(config, result));
        }
        out.flush();

        if (warned && config.failOnWarnings()) {
            return EXIT_WARNINGS;
        }
        return EXIT_OK;
    }

    private String render(Config config, ParseResult result) {
        return switch (config.outputFormat()) {
            case TEXT -> new CommitStyleRenderer().render(result, config.titleOverride(), config.poolInfo());
            case JSON -> new ParseResultJsonWriter().write(result) + System.lineSeparator();
            case SUMMARY -> new SummaryRenderer().render(result, config.titleOverride());
        };
    }
}
