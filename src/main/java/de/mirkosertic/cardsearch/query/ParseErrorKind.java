package de.mirkosertic.cardsearch.query;

/**
 * Categories of query parse failures. Every failure rejects the whole query.
 */
public enum ParseErrorKind {

    /** A double-quoted or slash-delimited span was opened but never closed. */
    UNTERMINATED_LITERAL,

    /** The text before the operator is not a known field alias. */
    UNKNOWN_FIELD,

    /** A comparison operator (or the unknown marker) was used on a field that does not support it. */
    OPERATOR_FIELD_MISMATCH,

    /** The regex did not compile, trailed extra characters, or targeted a non-text field. */
    INVALID_REGEX,

    /** One of the {@code |}-separated alternatives is empty. */
    EMPTY_ALTERNATIVE,

    /** A numeric field received something that is not a signed integer. */
    NOT_A_NUMBER,

    /** A literal contains whitespace but is not wrapped in double quotes. */
    UNQUOTED_SPACES,

    /** The operator is not followed by any value. */
    EMPTY_VALUE,

    /** The query has more clauses than the configured maximum. */
    TOO_MANY_CLAUSES
}
