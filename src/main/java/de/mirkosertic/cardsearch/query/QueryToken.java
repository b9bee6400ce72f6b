package de.mirkosertic.cardsearch.query;

/**
 * One whitespace-delimited unit of a query, with quotes and regex slashes still in place.
 *
 * @param text     the raw token text
 * @param position offset of the first character in the original query
 */
public record QueryToken(String text, int position) {
}
