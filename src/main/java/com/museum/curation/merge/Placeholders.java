package com.museum.curation.merge;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Recognizes values that carry no information: null, blank strings, placeholder
 * tokens such as "unknown" or "n/a", and empty collections.
 */
public final class Placeholders {

    private static final Set<String> TOKENS = Set.of(
            "", "unknown", "n/a", "tbd", "null", "none", "pending", "-"
    );

    private Placeholders() {
    }

    public static boolean isPlaceholder(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return TOKENS.contains(text.toString().trim().toLowerCase(Locale.ROOT));
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }

    /**
     * True for null and for strings that are empty after trimming.
     */
    public static boolean isNullOrEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.toString().isBlank();
        }
        return false;
    }

    /**
     * A stored value is meaningful when it is non-null and, for strings, non-blank.
     */
    public static boolean isMeaningful(Object value) {
        return !isNullOrEmpty(value);
    }
}
