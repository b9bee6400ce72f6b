package de.mirkosertic.cardsearch.query;

import java.util.Locale;

/**
 * Builds a {@link Clause} from one query token.
 * <p>
 * The token is split at the first operator lexeme found outside quoted and regex spans.
 * A token without an operator is a bare term and searches the name field, so
 * {@code blue-eyes}, {@code "dark magician"} and {@code /^elemental hero/} are all name searches.
 * A colon directly followed by another operator takes that operator.
 */
public class ClauseParser {

    private static final String COLON = ":";

    private final FieldRegistry registry;
    private final ValueParser valueParser;

    public ClauseParser(final FieldRegistry registry, final ValueParser valueParser) {
        this.registry = registry;
        this.valueParser = valueParser;
    }

    public Clause parse(final QueryToken token) throws QueryParseException {
        final String text = token.text();
        int index = 0;
        while (index < text.length()) {
            final String lexeme = Operator.lexemeAt(text, index);
            if (lexeme != null) {
                return fieldClause(token, index, lexeme);
            }
            index = Literals.skip(text, index, 0);
        }
        final FieldSpec name = registry.nameField();
        return new Clause(name, Operator.EQ, valueParser.parse(text, name, Operator.EQ, token.position()));
    }

    private Clause fieldClause(final QueryToken token, final int operatorIndex, final String lexeme)
            throws QueryParseException {
        final String text = token.text();
        final String alias = text.substring(0, operatorIndex);
        if (alias.isEmpty()) {
            throw new QueryParseException(ParseErrorKind.UNKNOWN_FIELD, text, token.position(),
                    "Missing field name before " + lexeme);
        }
        final FieldSpec field = registry.resolve(alias)
                .orElseThrow(() -> new QueryParseException(ParseErrorKind.UNKNOWN_FIELD, text, token.position(),
                        "Unknown field " + alias));
        // "atk:>=5" reads as "atk>=5"
        final String qualifier = COLON.equals(lexeme) ? Operator.lexemeAt(text, operatorIndex + 1) : null;
        final String effectiveLexeme = qualifier != null && !COLON.equals(qualifier) ? qualifier : lexeme;
        final Operator operator = Operator.fromLexeme(effectiveLexeme);
        if (operator.isComparison() && !field.kind().supportsComparison()) {
            throw new QueryParseException(ParseErrorKind.OPERATOR_FIELD_MISMATCH, text,
                    token.position() + operatorIndex,
                    "Operator " + effectiveLexeme + " is not supported on "
                            + field.kind().name().toLowerCase(Locale.ROOT) + " field " + field.canonicalName());
        }
        final int valueIndex = operatorIndex + lexeme.length()
                + (effectiveLexeme.equals(lexeme) ? 0 : effectiveLexeme.length());
        return new Clause(field, operator,
                valueParser.parse(text.substring(valueIndex), field, operator, token.position() + valueIndex));
    }
}
