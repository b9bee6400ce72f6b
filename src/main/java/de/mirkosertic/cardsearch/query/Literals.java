package de.mirkosertic.cardsearch.query;

/**
 * Scanning helpers shared by the tokenizer, the clause parser and the value parser so that
 * all three agree on where quoted and regex spans begin and end.
 */
final class Literals {

    static final char QUOTE = '"';
    static final char SLASH = '/';
    static final char ESCAPE = '\\';
    static final char ALTERNATIVE = '|';

    private static final String REGEX_OPENERS = "=<>:!|";

    private Literals() {
    }

    static boolean isWhitespace(final char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == '\u000B';
    }

    static boolean containsWhitespace(final String text) {
        for (int i = 0; i < text.length(); i++) {
            if (isWhitespace(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * A slash opens a regex span only at the start of a token or directly after an operator
     * character or an alternative separator. Slashes inside words ({@code D/D}) are plain text.
     */
    static boolean opensRegex(final String text, final int index, final int tokenStart) {
        if (text.charAt(index) != SLASH) {
            return false;
        }
        return index == tokenStart || REGEX_OPENERS.indexOf(text.charAt(index - 1)) >= 0;
    }

    /**
     * Finds the unescaped delimiter that closes the span opened at {@code open}.
     *
     * @return the index of the closing delimiter, or -1 if the span is unterminated
     */
    static int closingDelimiter(final String text, final int open) {
        final char delimiter = text.charAt(open);
        int i = open + 1;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (c == ESCAPE) {
                i += 2;
                continue;
            }
            if (c == delimiter) {
                return i;
            }
            i++;
        }
        return -1;
    }

    /**
     * Returns the index just past the quoted or regex span starting at {@code index},
     * {@code index + 2} for an escape sequence, or {@code index + 1} for any other character.
     * Unterminated spans run to the end of the text.
     */
    static int skip(final String text, final int index, final int tokenStart) {
        final char c = text.charAt(index);
        if (c == ESCAPE) {
            return Math.min(index + 2, text.length());
        }
        if (c == QUOTE || opensRegex(text, index, tokenStart)) {
            final int close = closingDelimiter(text, index);
            return close < 0 ? text.length() : close + 1;
        }
        return index + 1;
    }

    /**
     * Removes unescaped double quotes and resolves backslash escapes.
     */
    static String unquote(final String text) {
        final StringBuilder result = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (c == ESCAPE && i + 1 < text.length()) {
                result.append(text.charAt(i + 1));
                i += 2;
            } else {
                if (c != QUOTE) {
                    result.append(c);
                }
                i++;
            }
        }
        return result.toString();
    }
}
