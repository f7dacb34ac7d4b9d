package io.swimset.workout.cli;

import io.swimset.workout.config.LogFormat;
import io.swimset.workout.config.OutputFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "swimset-parse", mixinStandardHelpOptions = true, version = "swimset-parse 0.1.0",
        description = "Parses free-form swim workout text into sections, sets and lines")
public class CliArguments {

    @CommandLine.Parameters(arity = "0..*", paramLabel = "FILE", description = "Workout text files; '-' or none reads standard input")
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = "--format", converter = OutputFormatConverter.class, description = "Output format: text, json or summary")
    private OutputFormat outputFormat;

    @CommandLine.Option(names = "--default-section", paramLabel = "LABEL", description = "Section label used for content before any header")
    private String defaultSection;

    @CommandLine.Option(names = "--title", paramLabel = "TEXT", description = "Title printed instead of the parsed one")
    private String title;

    @CommandLine.Option(names = "--pool", paramLabel = "TEXT", description = "Pool description printed after the title, e.g. '25 Yards'")
    private String poolInfo;

    @CommandLine.Option(names = "--fail-on-warnings", description = "Exit with status 1 when any input produces parse warnings")
    private boolean failOnWarnings;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    private boolean verbose;

    public List<Path> inputs() {
        return inputs == null ? List.of() : List.copyOf(inputs);
    }

    public OutputFormat outputFormat() {
        return outputFormat;
    }

    public String defaultSection() {
        return defaultSection;
    }

    public String title() {
        return title;
    }

    public String poolInfo() {
        return poolInfo;
    }

    public boolean failOnWarnings() {
        return failOnWarnings;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
