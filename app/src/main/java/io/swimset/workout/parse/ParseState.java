package io.swimset.workout.parse;

import io.swimset.workout.model.ParseResult;
import io.swimset.workout.model.Section;
import io.swimset.workout.model.WorkoutLine;
import io.swimset.workout.model.WorkoutSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable state carried from one line to the next while a workout is folded into sections.
 * Every transition returns a new state.
 *
 * @param sections         completed, non-empty sections in document order
 * @param current          the section receiving sets, if one is open
 * @param group            the repeat-block buffer
 * @param title            the first line seen before any section header
 * @param sawSectionHeader whether a section header has been seen
 */
public record ParseState(List<Section> sections,
                         Optional<Section> current,
                         PendingGroup group,
                         Optional<String> title,
                         boolean sawSectionHeader) {

    static final String NO_SECTIONS_WARNING = "No sections found. Try adding 'Main Set' or 'Warmup'.";

    public ParseState {
        sections = sections == null ? List.of() : List.copyOf(sections);
        current = current == null ? Optional.empty() : current;
        group = Objects.requireNonNull(group, "group");
        title = title == null ? Optional.empty() : title;
    }

    public static ParseState initial() {
        return new ParseState(List.of(), Optional.empty(), PendingGroup.idle(), Optional.empty(), false);
    }

    /**
     * Emits the buffered lines as one repeated set. Flushing an empty buffer only resets the count.
     */
    public ParseState flushGroup(String fallbackLabel) {
        Optional<WorkoutSet> set = group.toSet();
        if (set.isEmpty()) {
            return group.isAccumulating() ? withGroup(PendingGroup.idle()) : this;
        }
        Section section = current.orElseGet(() -> Section.open(fallbackLabel)).append(set.get());
        return new ParseState(sections, Optional.of(section), PendingGroup.idle(), title, sawSectionHeader);
    }

    /**
     * Closes the open section, keeping it only if it has sets, and opens a new one.
     */
    public ParseState startSection(String label, String fallbackLabel) {
        ParseState flushed = flushGroup(fallbackLabel);
        return new ParseState(flushed.completedSections(), Optional.of(Section.open(label)),
                flushed.group, flushed.title, true);
    }

    /**
     * Records the first pre-header line as the title. Later pre-header lines leave the state unchanged.
     */
    public ParseState offerTitle(String line) {
        if (title.isPresent()) {
            return this;
        }
        return new ParseState(sections, current, group, Optional.of(line), sawSectionHeader);
    }

    public ParseState startGroup(int repeatCount, String fallbackLabel) {
        return flushGroup(fallbackLabel).withGroup(PendingGroup.accumulating(repeatCount));
    }

    public ParseState appendToGroup(WorkoutLine line) {
        return withGroup(group.append(line));
    }

    public ParseState appendSet(WorkoutSet set, String fallbackLabel) {
        Section section = current.orElseGet(() -> Section.open(fallbackLabel)).append(set);
        return new ParseState(sections, Optional.of(section), group, title, sawSectionHeader);
    }

    /**
     * Appends descriptor text to the line it annotates: the last buffered line while a repeat block
     * is collecting, otherwise the last line of the open section. Empty when there is no such line.
     */
    public Optional<ParseState> mergeDescriptor(String text) {
        if (group.isAccumulating()) {
            return group.lastLine()
                    .map(line -> withGroup(group.withLastLine(line.appendText(text))));
        }
        if (current.isEmpty()) {
            return Optional.empty();
        }
        Section section = current.get();
        return section.lastSet().flatMap(set -> set.lastLine().map(line -> {
            Section updated = section.withLastSet(set.withLastLine(line.appendText(text)));
            return new ParseState(sections, Optional.of(updated), group, title, sawSectionHeader);
        }));
    }

    /**
     * Final flush and assembly.
     *
     * @param nonEmptyInput whether the parsed text had any characters at all
     */
    public ParseResult finish(String fallbackLabel, boolean nonEmptyInput) {
        List<Section> result = flushGroup(fallbackLabel).completedSections();
        List<String> warnings = new ArrayList<>();
        if (result.isEmpty() && nonEmptyInput) {
            warnings.add(NO_SECTIONS_WARNING);
        }
        return new ParseResult(result, title, warnings);
    }

    private List<Section> completedSections() {
        if (current.isEmpty() || current.get().isEmpty()) {
            return sections;
        }
        List<Section> updated = new ArrayList<>(sections);
        updated.add(current.get());
        return updated;
    }

    private ParseState withGroup(PendingGroup updated) {
        return new ParseState(sections, current, updated, title, sawSectionHeader);
    }
}
