package de.mirkosertic.cardsearch.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.PatternSyntaxException;

/**
 * Turns the raw text after an operator into a {@link Value} for a given field.
 *
 * <p>Resolution order:</p>
 * <ol>
 *   <li>{@code /pattern/} becomes a {@link Value.RegexValue} (text fields only)</li>
 *   <li>an unescaped {@code |} outside quotes under {@code =} or {@code !=} becomes a {@link Value.SetValue}</li>
 *   <li>anything else is a single integer or lower-cased literal</li>
 * </ol>
 * Literal text is folded to lower case here, so evaluation compares already folded strings.
 */
public class ValueParser {

    private static final String UNKNOWN_MARKER = "?";

    private final RegexCache regexCache;

    public ValueParser(final RegexCache regexCache) {
        this.regexCache = regexCache;
    }

    /**
     * Parses {@code raw} as a value of {@code field}.
     *
     * @param raw      the value text, quotes and slashes included
     * @param field    the target field
     * @param operator the clause operator, already validated against the field kind
     * @param position offset of {@code raw} in the original query, for error reporting
     * @return the parsed value
     * @throws QueryParseException if the text is not a legal value for the field and operator
     */
    public Value parse(final String raw, final FieldSpec field, final Operator operator, final int position)
            throws QueryParseException {
        if (raw.isEmpty()) {
            throw new QueryParseException(ParseErrorKind.EMPTY_VALUE, raw, position,
                    "Missing value for field " + field.canonicalName());
        }
        if (raw.charAt(0) == Literals.SLASH) {
            return parseRegex(raw, field, operator, position);
        }
        if (!operator.isComparison()) {
            final List<String> alternatives = splitAlternatives(raw);
            if (alternatives.size() > 1) {
                return parseSet(raw, alternatives, field, position);
            }
        }
        return parseSingle(raw, field, operator, position);
    }

    private Value parseRegex(final String raw, final FieldSpec field, final Operator operator, final int position)
            throws QueryParseException {
        final int close = Literals.closingDelimiter(raw, 0);
        if (close < 0) {
            throw new QueryParseException(ParseErrorKind.UNTERMINATED_LITERAL, raw, position,
                    "Missing closing slash of regex");
        }
        if (close != raw.length() - 1) {
            throw new QueryParseException(ParseErrorKind.INVALID_REGEX, raw, position + close + 1,
                    "Unexpected characters after regex: " + raw.substring(close + 1));
        }
        if (!field.kind().isTextual()) {
            throw new QueryParseException(ParseErrorKind.INVALID_REGEX, raw, position,
                    "Regular expressions are only supported on text fields, not on " + field.canonicalName());
        }
        if (operator.isComparison()) {
            throw new QueryParseException(ParseErrorKind.OPERATOR_FIELD_MISMATCH, raw, position,
                    "Regular expressions only support = and !=");
        }
        final String source = unescapeSlashes(raw.substring(1, close));
        try {
            return new Value.RegexValue(source, regexCache.compile(source));
        } catch (final PatternSyntaxException e) {
            throw new QueryParseException(ParseErrorKind.INVALID_REGEX, raw, position,
                    "Invalid regular expression /" + source + "/: " + e.getDescription(), e);
        }
    }

    private Value parseSet(final String raw, final List<String> alternatives, final FieldSpec field,
                           final int position) throws QueryParseException {
        final List<Value> members = new ArrayList<>(alternatives.size());
        int offset = 0;
        for (final String alternative : alternatives) {
            if (alternative.isEmpty()) {
                throw new QueryParseException(ParseErrorKind.EMPTY_ALTERNATIVE, raw, position + offset,
                        "Empty alternative in " + raw);
            }
            if (alternative.charAt(0) == Literals.SLASH && field.kind().isTextual()) {
                throw new QueryParseException(ParseErrorKind.INVALID_REGEX, raw, position + offset,
                        "Regular expressions cannot be combined with |");
            }
            if (UNKNOWN_MARKER.equals(alternative) && field.kind() == FieldKind.NUMERIC) {
                throw new QueryParseException(ParseErrorKind.NOT_A_NUMBER, raw, position + offset,
                        "? cannot be combined with |");
            }
            members.add(parseSingle(alternative, field, Operator.EQ, position + offset));
            offset += alternative.length() + 1;
        }
        return new Value.SetValue(members);
    }

    private Value parseSingle(final String raw, final FieldSpec field, final Operator operator, final int position)
            throws QueryParseException {
        if (field.kind() == FieldKind.NUMERIC) {
            return parseNumber(raw, field, operator, position);
        }
        return parseLiteral(raw, position);
    }

    private Value parseNumber(final String raw, final FieldSpec field, final Operator operator, final int position)
            throws QueryParseException {
        if (UNKNOWN_MARKER.equals(raw) && field.allowsUnknown()) {
            if (operator.isComparison()) {
                throw new QueryParseException(ParseErrorKind.OPERATOR_FIELD_MISMATCH, raw, position,
                        "? only supports = and !=");
            }
            return Value.UnknownValue.INSTANCE;
        }
        try {
            return new Value.IntegerValue(Long.parseLong(raw));
        } catch (final NumberFormatException e) {
            throw new QueryParseException(ParseErrorKind.NOT_A_NUMBER, raw, position,
                    field.canonicalName() + " expects a whole number", e);
        }
    }

    private Value parseLiteral(final String raw, final int position) throws QueryParseException {
        final boolean wrapped = raw.charAt(0) == Literals.QUOTE
                && Literals.closingDelimiter(raw, 0) == raw.length() - 1;
        final String text;
        if (wrapped) {
            text = Literals.unquote(raw.substring(1, raw.length() - 1));
        } else {
            if (Literals.containsWhitespace(raw)) {
                throw new QueryParseException(ParseErrorKind.UNQUOTED_SPACES, raw, position,
                        "Values containing spaces must be wrapped in double quotes");
            }
            text = Literals.unquote(raw);
        }
        if (text.isEmpty()) {
            throw new QueryParseException(ParseErrorKind.EMPTY_VALUE, raw, position, "Empty value");
        }
        return new Value.TextValue(text.toLowerCase(Locale.ROOT));
    }

    /**
     * Splits on {@code |} outside quoted spans and escape sequences.
     */
    static List<String> splitAlternatives(final String raw) {
        final List<String> parts = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < raw.length()) {
            final char c = raw.charAt(i);
            if (c == Literals.ALTERNATIVE) {
                parts.add(raw.substring(start, i));
                start = i + 1;
                i++;
            } else if (c == Literals.QUOTE || c == Literals.ESCAPE) {
                i = Literals.skip(raw, i, start);
            } else {
                i++;
            }
        }
        parts.add(raw.substring(start));
        return parts;
    }

    private static String unescapeSlashes(final String inner) {
        final StringBuilder result = new StringBuilder(inner.length());
        int i = 0;
        while (i < inner.length()) {
            final char c = inner.charAt(i);
            if (c == Literals.ESCAPE && i + 1 < inner.length()) {
                if (inner.charAt(i + 1) != Literals.SLASH) {
                    result.append(c);
                }
                result.append(inner.charAt(i + 1));
                i += 2;
            } else {
                result.append(c);
                i++;
            }
        }
        return result.toString();
    }
}
