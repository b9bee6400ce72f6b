package de.mirkosertic.cardsearch.query;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The right-hand side of a clause.
 * <p>
 * Values render themselves in the canonical query syntax via {@link #toQueryString()}, which
 * parses back to an equal value, and as human readable text via {@link #describe()}.
 */
public interface Value {

    String toQueryString();

    String describe();

    record IntegerValue(long value) implements Value {

        @Override
        public String toQueryString() {
            return Long.toString(value);
        }

        @Override
        public String describe() {
            return Long.toString(value);
        }
    }

    /**
     * A lower-cased literal.
     */
    record TextValue(String text) implements Value {

        private static final String SYNTAX_CHARACTERS = "\"|\\=<>!:/";

        @Override
        public String toQueryString() {
            if (!needsQuoting()) {
                return text;
            }
            final StringBuilder quoted = new StringBuilder(text.length() + 2).append(Literals.QUOTE);
            for (int i = 0; i < text.length(); i++) {
                final char c = text.charAt(i);
                if (c == Literals.QUOTE || c == Literals.ESCAPE) {
                    quoted.append(Literals.ESCAPE);
                }
                quoted.append(c);
            }
            return quoted.append(Literals.QUOTE).toString();
        }

        @Override
        public String describe() {
            return "“" + text + "”";
        }

        private boolean needsQuoting() {
            for (int i = 0; i < text.length(); i++) {
                final char c = text.charAt(i);
                if (Literals.isWhitespace(c) || SYNTAX_CHARACTERS.indexOf(c) >= 0) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * Alternatives separated by {@code |}. All members share one kind and keep their input order.
     */
    record SetValue(List<Value> members) implements Value {

        public SetValue {
            members = List.copyOf(members);
        }

        @Override
        public String toQueryString() {
            return members.stream()
                    .map(Value::toQueryString)
                    .collect(Collectors.joining(String.valueOf(Literals.ALTERNATIVE)));
        }

        @Override
        public String describe() {
            return "one of " + members.stream()
                    .map(Value::describe)
                    .collect(Collectors.joining(", "));
        }
    }

    /**
     * A case-insensitive pattern. Two regex values are equal when their pattern source is.
     *
     * @param source  the pattern text between the slashes, with {@code \/} already resolved
     * @param pattern the compiled pattern
     */
    record RegexValue(String source, Pattern pattern) implements Value {

        @Override
        public String toQueryString() {
            final StringBuilder result = new StringBuilder(source.length() + 2).append(Literals.SLASH);
            int i = 0;
            while (i < source.length()) {
                final char c = source.charAt(i);
                if (c == Literals.ESCAPE && i + 1 < source.length()) {
                    result.append(c).append(source.charAt(i + 1));
                    i += 2;
                    continue;
                }
                if (c == Literals.SLASH) {
                    result.append(Literals.ESCAPE);
                }
                result.append(c);
                i++;
            }
            return result.append(Literals.SLASH).toString();
        }

        @Override
        public String describe() {
            return toQueryString();
        }

        @Override
        public boolean equals(final Object other) {
            return other instanceof RegexValue regex && regex.source.equals(source);
        }

        @Override
        public int hashCode() {
            return source.hashCode();
        }
    }

    /**
     * The {@code ?} marker for monsters whose ATK or DEF is not a number.
     */
    enum UnknownValue implements Value {
        INSTANCE;

        @Override
        public String toQueryString() {
            return "?";
        }

        @Override
        public String describe() {
            return "unknown";
        }
    }
}
