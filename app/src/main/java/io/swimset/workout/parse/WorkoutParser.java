package io.swimset.workout.parse;

import io.swimset.workout.model.ParseResult;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses free-form workout text into sections, sets and lines.
 * <p>
 * Parsing is a fold over classified lines: each line maps the current {@link ParseState} to the next
 * one. The parser holds no per-call state, so one instance can be shared between threads, and it
 * never throws for any input; problems surface as warnings on the result.
 */
public class WorkoutParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkoutParser.class);
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private final ParserOptions options;
    private final LineClassifier classifier;
    private final LineParser lineParser;

    public WorkoutParser() {
        this(ParserOptions.defaults());
    }

    public WorkoutParser(ParserOptions options) {
        this(options, new DefaultLineClassifier(), new LineParser());
    }

    public WorkoutParser(ParserOptions options, LineClassifier classifier, LineParser lineParser) {
        this.options = Objects.requireNonNull(options, "options");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.lineParser = Objects.requireNonNull(lineParser, "lineParser");
    }

    public ParseResult parse(String text) {
        String source = text == null ? "" : text;
        List<String> lines = Arrays.asList(LINE_BREAK.split(source, -1));

        ParseState state = ParseState.initial();
        for (ClassifiedLine line : classifier.classify(lines)) {
            state = accept(state, line);
        }
        ParseResult result = state.finish(options.defaultSectionLabel(), !source.isEmpty());
        LOGGER.debug("Parsed {} lines into {} sections ({} warnings)",
                lines.size(), result.sections().size(), result.warnings().size());
        return result;
    }

    /**
     * Applies one classified line to the state.
     */
    ParseState accept(ParseState state, ClassifiedLine line) {
        String fallback = options.defaultSectionLabel();
        if (line.kind() == LineKind.BLANK) {
            return state.flushGroup(fallback);
        }
        if (line.kind() == LineKind.COMMENT) {
            return state;
        }
        if (line.kind() == LineKind.SECTION_HEADER) {
            return state.startSection(line.section().orElseThrow().displayName(), fallback);
        }

        if (!state.sawSectionHeader()) {
            if (state.title().isPresent()) {
                // TODO: decide whether extra preamble lines should be kept as notes instead of dropped
                LOGGER.debug("Dropping line before first section header: {}", line.trimmed());
            }
            return state.offerTitle(line.trimmed());
        }

        if (line.kind() == LineKind.ROUND_HEADER) {
            return state.startGroup(line.roundCount(), fallback);
        }
        return acceptContent(state, line, fallback);
    }

    private ParseState acceptContent(ParseState state, ClassifiedLine line, String fallback) {
        ParsedLine parsed = lineParser.parseLine(line.trimmed());

        if (parsed.isDescriptor()) {
            Optional<ParseState> merged = state.mergeDescriptor(parsed.strippedText());
            if (merged.isPresent()) {
                LOGGER.debug("Merged descriptor into previous line: {}", parsed.strippedText());
                return merged.get();
            }
        }

        if (state.group().isAccumulating()) {
            if (line.indented()) {
                return state.appendToGroup(parsed.line());
            }
            return state.flushGroup(fallback).appendSet(parsed.set(), fallback);
        }
        return state.appendSet(parsed.set(), fallback);
    }
}
