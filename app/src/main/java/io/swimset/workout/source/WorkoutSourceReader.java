package io.swimset.workout.source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads UTF-8 workout text from files, or from standard input when no file (or {@code -}) is given.
 */
public class WorkoutSourceReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkoutSourceReader.class);
    private static final String STDIN_MARKER = "-";

    private final InputStream stdin;

    public WorkoutSourceReader() {
        this(System.in);
    }

    public WorkoutSourceReader(InputStream stdin) {
        this.stdin = Objects.requireNonNull(stdin, "stdin");
    }

    public List<WorkoutSource> read(List<Path> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            return List.of(readStdin());
        }
        List<WorkoutSource> sources = new ArrayList<>(inputs.size());
        for (Path input : inputs) {
            sources.add(STDIN_MARKER.equals(input.toString()) ? readStdin() : readFile(input));
        }
        return sources;
    }

    private WorkoutSource readFile(Path path) {
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            LOGGER.debug("Read {} characters from {}", text.length(), path);
            return new WorkoutSource(path.toString(), text);
        } catch (IOException ex) {
            throw new WorkoutSourceException("Failed to read workout file: " + path, ex);
        }
    }

    private WorkoutSource readStdin() {
        try {
            return new WorkoutSource(WorkoutSource.STDIN_NAME, new String(stdin.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new WorkoutSourceException("Failed to read workout text from standard input", ex);
        }
    }
}
