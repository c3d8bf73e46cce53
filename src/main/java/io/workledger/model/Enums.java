package io.workledger.model;

import io.workledger.error.InvalidArgumentException;

import java.util.Locale;

/**
 * Storage representation of enum-valued columns: the constant name on write, a lenient parse on
 * read and on caller input ({@code "sub_finished"}, {@code "SubFinished"} and {@code "SUB_FINISHED"}
 * are the same value).
 */
public final class Enums {
    private Enums() {
    }

    public static String name(Enum<?> value) {
        return value == null ? null : value.name();
    }

    public static <E extends Enum<E>> E parse(Class<E> type, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String wanted = normalize(raw);
        for (E value : type.getEnumConstants()) {
            if (normalize(value.name()).equals(wanted)) {
                return value;
            }
        }
        throw new InvalidArgumentException("Unknown " + type.getSimpleName() + ": " + raw);
    }

    public static <E extends Enum<E>> E parse(Class<E> type, Object raw) {
        if (raw == null) {
            return null;
        }
        if (type.isInstance(raw)) {
            return type.cast(raw);
        }
        return parse(type, String.valueOf(raw));
    }

    private static String normalize(String raw) {
        return raw.trim().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
