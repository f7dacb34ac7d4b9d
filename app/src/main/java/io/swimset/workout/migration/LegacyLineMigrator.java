package io.swimset.workout.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swimset.workout.model.Effort;
import io.swimset.workout.model.EnumNames;
import io.swimset.workout.model.IntervalKind;
import io.swimset.workout.model.Stroke;
import io.swimset.workout.model.SwimMode;
import io.swimset.workout.model.WorkoutLine;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Upgrades stored line records to the current schema once, at load time.
 * <p>
 * Version 1 records kept modes (kick, drill, ...) in the {@code stroke} field, stored the interval as
 * display text ({@code "@ 1:30"}) with a separate {@code intervalType}, and kept the pace under
 * {@code patterns.pace}. Version 2 records have {@code mode}, {@code intervalSeconds},
 * {@code intervalKind} and {@code effort}.
 */
public class LegacyLineMigrator {

    public static final int CURRENT_SCHEMA_VERSION = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(LegacyLineMigrator.class);

    // checked in this order: "free drill" is a drill, not a swim
    private static final List<SwimMode> MODE_INFERENCE_ORDER = List.of(
            SwimMode.DRILL, SwimMode.KICK, SwimMode.PULL, SwimMode.SCULL, SwimMode.TECHNIQUE, SwimMode.SWIM);

    public WorkoutLine migrate(JsonNode record) {
        if (record == null || !record.isObject()) {
            throw new IllegalArgumentException("Line record must be a JSON object");
        }
        ObjectNode upgraded = record.deepCopy();
        int version = upgraded.path("schemaVersion").asInt(1);
        if (version < CURRENT_SCHEMA_VERSION) {
            upgradeFromVersion1(upgraded);
        }
        return read(upgraded);
    }

    void upgradeFromVersion1(ObjectNode record) {
        String legacyStroke = textOf(record, "stroke").orElse(null);
        if (legacyStroke != null && SwimMode.isMode(legacyStroke)) {
            if (!record.hasNonNull("mode")) {
                record.put("mode", legacyStroke);
            }
            record.remove("stroke");
        } else if ("other".equalsIgnoreCase(legacyStroke)) {
            record.remove("stroke");
        }

        if (!record.hasNonNull("mode")) {
            inferMode(record.path("text").asText("")).ifPresent(mode -> record.put("mode", EnumNames.toCamel(mode)));
        }

        if (!record.hasNonNull("intervalSeconds")) {
            textOf(record, "interval")
                    .map(LegacyLineMigrator::parseIntervalText)
                    .filter(OptionalInt::isPresent)
                    .ifPresent(seconds -> record.put("intervalSeconds", seconds.getAsInt()));
        }

        if (!record.hasNonNull("intervalKind")) {
            IntervalKind kind = IntervalKind.NONE;
            if (record.hasNonNull("intervalSeconds")) {
                kind = "rest".equalsIgnoreCase(record.path("intervalType").asText("interval"))
                        ? IntervalKind.REST
                        : IntervalKind.SENDOFF;
            }
            record.put("intervalKind", EnumNames.toCamel(kind));
        }

        if (!record.hasNonNull("effort")) {
            textOf(record.path("patterns"), "pace").ifPresent(pace -> record.put("effort", pace));
        }

        record.remove(List.of("interval", "intervalType", "patterns", "yardageOverride"));
        record.put("schemaVersion", CURRENT_SCHEMA_VERSION);
    }

    private WorkoutLine read(ObjectNode record) {
        WorkoutLine.Builder builder = WorkoutLine.builder()
                .id(textOf(record, "id").flatMap(LegacyLineMigrator::parseUuid).orElseGet(UUID::randomUUID))
                .reps(positiveInt(record, "reps"))
                .distance(nonNegativeInt(record, "distance"))
                .stroke(textOf(record, "stroke").flatMap(value -> lookup(Stroke.class, value)).orElse(null))
                .mode(textOf(record, "mode").flatMap(value -> lookup(SwimMode.class, value)).orElse(null))
                .effort(textOf(record, "effort").flatMap(value -> lookup(Effort.class, value)).orElse(null))
                .text(record.path("text").asText(""));
        Integer seconds = nonNegativeInt(record, "intervalSeconds");
        IntervalKind kind = textOf(record, "intervalKind")
                .flatMap(value -> lookup(IntervalKind.class, value))
                .orElse(IntervalKind.NONE);
        if (seconds == null) {
            kind = IntervalKind.NONE;
        }
        builder.interval(seconds, kind);
        return builder.build();
    }

    static Optional<SwimMode> inferMode(String text) {
        String lowercase = text.toLowerCase(Locale.ROOT);
        for (SwimMode mode : MODE_INFERENCE_ORDER) {
            if (lowercase.contains(mode.keyword())) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }

    static OptionalInt parseIntervalText(String raw) {
        String cleaned = raw.replace("@", "").strip();
        try {
            String[] parts = cleaned.split(":", -1);
            if (parts.length == 2) {
                int minutes = parts[0].isBlank() ? 0 : Integer.parseInt(parts[0].strip());
                int seconds = Integer.parseInt(parts[1].strip());
                return OptionalInt.of(minutes * 60 + seconds);
            }
            if (parts.length == 1 && !cleaned.isEmpty()) {
                return OptionalInt.of(Integer.parseInt(cleaned));
            }
        } catch (NumberFormatException ex) {
            LOGGER.warn("Ignoring unreadable legacy interval '{}'", raw);
        }
        return OptionalInt.empty();
    }

    private static <E extends Enum<E>> Optional<E> lookup(Class<E> type, String raw) {
        Optional<E> value = EnumNames.fromCamel(type, raw);
        if (value.isEmpty() && type == SwimMode.class && SwimMode.isMode(raw)) {
            return Optional.of(type.cast(SwimMode.from(raw)));
        }
        if (value.isEmpty()) {
            LOGGER.warn("Ignoring unknown {} value '{}'", type.getSimpleName(), raw);
        }
        return value;
    }

    private static Optional<String> textOf(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? Optional.of(value.asText()) : Optional.empty();
    }

    private static Integer positiveInt(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.canConvertToInt() && value.asInt() > 0 ? value.asInt() : null;
    }

    private static Integer nonNegativeInt(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.canConvertToInt() && value.asInt() >= 0 ? value.asInt() : null;
    }

    private static Optional<UUID> parseUuid(String raw) {
        try {
            return Optional.of(UUID.fromString(raw));
        } catch (IllegalArgumentException ex) {
            LOGGER.warn("Replacing malformed line id '{}'", raw);
            return Optional.empty();
        }
    }
}
