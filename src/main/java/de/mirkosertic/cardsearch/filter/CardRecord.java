package de.mirkosertic.cardsearch.filter;

import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only view of one card as the evaluator sees it: canonical field name to an integer
 * ({@link Long}), a string, or a list of strings.
 * <p>
 * Records built with {@link #of(Map)} fold all strings to lower case once, at construction.
 * Other implementations may hand out mixed case strings, {@link Integer} values or lists with
 * foreign elements; the evaluator folds the strings and ignores what it cannot compare.
 */
public interface CardRecord {

    /**
     * Returns the value of a field, or null if the card has no value for it.
     */
    @Nullable
    Object value(String canonicalField);

    /**
     * Creates a normalized record.
     *
     * @param fields integral numbers, strings or collections of strings, keyed by canonical field name
     * @throws IllegalArgumentException for any other value type
     */
    static CardRecord of(final Map<String, ?> fields) {
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (final Map.Entry<String, ?> entry : fields.entrySet()) {
            final Object value = normalize(entry.getKey(), entry.getValue());
            if (value != null) {
                normalized.put(entry.getKey(), value);
            }
        }
        return new MapCardRecord(Map.copyOf(normalized));
    }

    private static @Nullable Object normalize(final String field, final @Nullable Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof String text) {
            return text.toLowerCase(Locale.ROOT);
        }
        if (value instanceof Collection<?> values) {
            return values.stream()
                    .map(element -> {
                        if (!(element instanceof String text)) {
                            throw new IllegalArgumentException("Field " + field + " holds a non-string element: " + element);
                        }
                        return text.toLowerCase(Locale.ROOT);
                    })
                    .toList();
        }
        throw new IllegalArgumentException("Field " + field + " has unsupported type " + value.getClass().getName());
    }

    record MapCardRecord(Map<String, Object> fields) implements CardRecord {

        @Override
        public @Nullable Object value(final String canonicalField) {
            return fields.get(canonicalField);
        }
    }

    /**
     * Convenience for tests and adapters: a record from alternating field names and values.
     */
    static CardRecord of(final Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected field/value pairs");
        }
        final Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put((String) keyValues[i], keyValues[i + 1]);
        }
        return of(fields);
    }
}
