package io.swimset.workout.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Converts enum constants to and from the lower camel case names used in stored records
 * ({@code RACE_PACE} ⇄ {@code racePace}).
 */
public final class EnumNames {

    private EnumNames() {
    }

    public static String toCamel(Enum<?> value) {
        String[] words = value.name().toLowerCase(Locale.ROOT).split("_");
        StringBuilder builder = new StringBuilder(words[0]);
        for (int i = 1; i < words.length; i++) {
            if (!words[i].isEmpty()) {
                builder.append(Character.toUpperCase(words[i].charAt(0))).append(words[i].substring(1));
            }
        }
        return builder.toString();
    }

    public static <E extends Enum<E>> Optional<E> fromCamel(Class<E> type, String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.strip().replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(normalized)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }
}
