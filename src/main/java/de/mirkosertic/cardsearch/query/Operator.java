package de.mirkosertic.cardsearch.query;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Clause operators. {@code ==}, {@code =} and {@code :} all mean {@link #EQ}.
 */
public enum Operator {

    EQ(":", "is"),
    NE("!=", "is not"),
    LT("<", "is less than"),
    LE("<=", "is at most"),
    GT(">", "is greater than"),
    GE(">=", "is at least");

    /**
     * Operator lexemes in matching order. Two-character lexemes come first so that
     * {@code ==}, {@code !=}, {@code <=} and {@code >=} are never split at their {@code =}.
     */
    static final List<String> LEXEMES = List.of("==", "!=", "<=", ">=", "=", "<", ">", ":");

    private final String canonicalLexeme;
    private final String phrase;

    Operator(final String canonicalLexeme, final String phrase) {
        this.canonicalLexeme = canonicalLexeme;
        this.phrase = phrase;
    }

    public String canonicalLexeme() {
        return canonicalLexeme;
    }

    public String phrase() {
        return phrase;
    }

    public boolean isComparison() {
        return this != EQ && this != NE;
    }

    /**
     * Returns the operator lexeme starting at {@code index}, or null if there is none.
     */
    static @Nullable String lexemeAt(final String text, final int index) {
        for (final String lexeme : LEXEMES) {
            if (text.startsWith(lexeme, index)) {
                return lexeme;
            }
        }
        return null;
    }

    static Operator fromLexeme(final String lexeme) {
        return switch (lexeme) {
            case "==", "=", ":" -> EQ;
            case "!=" -> NE;
            case "<" -> LT;
            case "<=" -> LE;
            case ">" -> GT;
            case ">=" -> GE;
            default -> throw new IllegalArgumentException("Unknown operator: " + lexeme);
        };
    }

    /**
     * Compares a card value against a query value.
     */
    public boolean compare(final long actual, final long expected) {
        return switch (this) {
            case EQ -> actual == expected;
            case NE -> actual != expected;
            case LT -> actual < expected;
            case LE -> actual <= expected;
            case GT -> actual > expected;
            case GE -> actual >= expected;
        };
    }
}
