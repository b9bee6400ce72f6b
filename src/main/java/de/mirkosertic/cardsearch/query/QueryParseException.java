package de.mirkosertic.cardsearch.query;

/**
 * Thrown when a search query cannot be parsed.
 * <p>
 * Carries the {@link ParseErrorKind}, the offending token and its character offset
 * in the original query so a caller can render a precise message.
 */
public class QueryParseException extends Exception {

    private final ParseErrorKind kind;
    private final String token;
    private final int position;

    public QueryParseException(final ParseErrorKind kind, final String token, final int position,
                               final String detail) {
        this(kind, token, position, detail, null);
    }

    public QueryParseException(final ParseErrorKind kind, final String token, final int position,
                               final String detail, final Throwable cause) {
        super(detail + " (" + kind + " at position " + position + ": “" + token + "”)", cause);
        this.kind = kind;
        this.token = token;
        this.position = position;
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    public String getToken() {
        return token;
    }

    public int getPosition() {
        return position;
    }
}
