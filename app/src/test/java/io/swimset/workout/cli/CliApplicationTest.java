package io.swimset.workout.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.swimset.workout.config.ConfigLoader;
import io.swimset.workout.source.WorkoutSourceReader;
import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final StringWriter output = new StringWriter();

    private CliApplication application(String stdin) {
        return new CliApplication(
                new ConfigLoader(key -> Optional.empty()),
                new WorkoutSourceReader(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8))),
                new PrintWriter(output, true));
    }

    @Test
    void printsCommitStyleTextFromStandardInput() {
        int exitCode = application("Main Set\n4x100 free @ 1:30\n").run(new String[] {"--title", "Sprint day"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(output.toString()).startsWith("Sprint day\n\nMain Set\n4x100 free @ 1:30\n");
    }

    @Test
    void printsSummaryForEachFile() throws Exception {
        Path monday = tempDir.resolve("monday.txt");
        Path tuesday = tempDir.resolve("tuesday.txt");
        Files.writeString(monday, "Warmup\n400 free\n", StandardCharsets.UTF_8);
        Files.writeString(tuesday, "Main Set\n10x100 back\n", StandardCharsets.UTF_8);

        int exitCode = application("").run(new String[] {"--format", "summary", monday.toString(), tuesday.toString()});

        assertThat(exitCode).isZero();
        assertThat(output.toString()).contains("Total: 400 (1 sets)").contains("Total: 1,000 (1 sets)");
    }

    @Test
    void printsJson() {
        int exitCode = application("Main Set\n200 ez\n").run(new String[] {"--format", "json"});

        assertThat(exitCode).isZero();
        assertThat(output.toString()).contains("\"totalYardage\" : 200");
    }

    @Test
    void warningsFailOnlyWhenRequested() {
        assertThat(application("no headers here").run(new String[0])).isEqualTo(CliApplication.EXIT_OK);
        assertThat(application("no headers here").run(new String[] {"--fail-on-warnings"}))
                .isEqualTo(CliApplication.EXIT_WARNINGS);
    }

    @Test
    void reportsUnreadableInput() {
        int exitCode = application("").run(new String[] {tempDir.resolve("missing.txt").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_UNREADABLE_INPUT);
        assertThat(output.toString()).isEmpty();
    }

    @Test
    void rejectsUnknownOptions() {
        int expected = new CommandLine(new CliArguments()).getCommandSpec().exitCodeOnInvalidInput();

        assertThat(application("").run(new String[] {"--format", "xml"})).isEqualTo(expected);
        assertThat(application("").run(new String[] {"--no-such-option"})).isEqualTo(expected);
        assertThat(output.toString()).isEmpty();
    }

    @Test
    void printsUsageHelp() {
        assertThat(application("").run(new String[] {"--help"})).isZero();
    }
}
