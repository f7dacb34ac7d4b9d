package io.swimset.workout.parse;

import io.swimset.workout.model.SectionLabel;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Recognizes section headers such as "WU", "Main Set" or "Post Set - Pull".
 * <p>
 * A line is a header when it equals an alias, or starts with one that is followed by the end of the
 * line, a space, {@code -}, {@code :} or {@code –}; "mslowly" is not "ms".
 */
public class SectionDetector {

    private static final Map<String, SectionLabel> ALIASES = aliases();
    private static final List<String> PREFIX_ORDER = prefixOrder();

    public Optional<SectionLabel> detect(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String normalized = line.strip().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        SectionLabel exact = ALIASES.get(normalized);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (String alias : PREFIX_ORDER) {
            if (normalized.startsWith(alias) && isBoundary(normalized, alias.length())) {
                return Optional.of(ALIASES.get(alias));
            }
        }
        return Optional.empty();
    }

    private static boolean isBoundary(String text, int index) {
        if (index == text.length()) {
            return true;
        }
        char next = text.charAt(index);
        return next == ' ' || next == '-' || next == ':' || next == '–';
    }

    private static Map<String, SectionLabel> aliases() {
        Map<String, SectionLabel> aliases = new LinkedHashMap<>();
        register(aliases, SectionLabel.WARMUP, "warmup", "warm-up", "warm up", "wu");
        register(aliases, SectionLabel.PRE_SET, "pre-set", "preset", "pre set", "ps");
        register(aliases, SectionLabel.MAIN_SET, "main", "main set", "ms");
        // reset, recovery, technique and drills all collapse into the post-set section
        register(aliases, SectionLabel.POST_SET, "post-set", "post set", "post", "reset", "recovery", "technique", "drills");
        register(aliases, SectionLabel.COOLDOWN, "cooldown", "cool-down", "cool down", "warmdown", "warm-down", "warm down", "cd");
        return Map.copyOf(aliases);
    }

    private static void register(Map<String, SectionLabel> aliases, SectionLabel label, String... keys) {
        for (String key : keys) {
            aliases.put(key, label);
        }
    }

    private static List<String> prefixOrder() {
        List<String> order = new ArrayList<>(ALIASES.keySet());
        order.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        return List.copyOf(order);
    }
}
