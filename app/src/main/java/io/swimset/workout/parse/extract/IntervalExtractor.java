package io.swimset.workout.parse.extract;

import io.swimset.workout.model.IntervalKind;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a sendoff ({@code @ 1:30}, {@code @ :50}, {@code @ :55-1:05}) or a rest
 * ({@code :15 rest}, {@code rest 1:00}). A sendoff range keeps only its lower bound.
 * Sendoffs are tried first, then rests.
 */
public final class IntervalExtractor {

    private static final Pattern SENDOFF = Pattern.compile(
            "@\\s*(?:(\\d+)?:)?(\\d+)(?:\\s*[–-]\\s*(?:\\d+)?:?\\d+)?");
    private static final Pattern REST_AFTER = Pattern.compile(
            "(?:(\\d+)?:)?(\\d+)\\s*rest\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern REST_BEFORE = Pattern.compile(
            "\\brest\\s+(\\d+)?:(\\d+)", Pattern.CASE_INSENSITIVE);

    private static final List<Candidate> CANDIDATES = List.of(
            new Candidate(SENDOFF, IntervalKind.SENDOFF),
            new Candidate(REST_AFTER, IntervalKind.REST),
            new Candidate(REST_BEFORE, IntervalKind.REST));

    public Extraction<Interval> extract(String text) {
        for (Candidate candidate : CANDIDATES) {
            Matcher matcher = candidate.pattern().matcher(text);
            while (matcher.find()) {
                Optional<Interval> interval = toInterval(matcher, candidate.kind());
                if (interval.isPresent()) {
                    return Extraction.found(interval.get(), TextCuts.cut(text, matcher));
                }
            }
        }
        return Extraction.none(text);
    }

    // a number that does not fit in an int leaves the text where it is
    private static Optional<Interval> toInterval(Matcher matcher, IntervalKind kind) {
        OptionalInt minutes = matcher.group(1) == null ? OptionalInt.of(0) : TextCuts.parseInt(matcher.group(1));
        OptionalInt seconds = TextCuts.parseInt(matcher.group(2));
        if (minutes.isEmpty() || seconds.isEmpty()) {
            return Optional.empty();
        }
        long total = minutes.getAsInt() * 60L + seconds.getAsInt();
        if (total > Integer.MAX_VALUE) {
            return Optional.empty();
        }
        return Optional.of(new Interval((int) total, kind));
    }

    private record Candidate(Pattern pattern, IntervalKind kind) {
    }
}
