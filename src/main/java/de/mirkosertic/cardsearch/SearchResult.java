package de.mirkosertic.cardsearch;

import de.mirkosertic.cardsearch.query.Query;

import java.util.List;

/**
 * Outcome of one search.
 *
 * @param query      the parsed query
 * @param matches    matching cards in input order, at most the result limit
 * @param truncated  true if more cards matched than were returned
 * @param durationMs evaluation time in milliseconds
 * @param <T>        the card type searched
 */
public record SearchResult<T>(Query query, List<T> matches, boolean truncated, long durationMs) {

    public SearchResult {
        matches = List.copyOf(matches);
    }

    /**
     * The line shown above the results, e.g. {@code Showing 3 results where level is 4 and attribute is “dark”}.
     */
    public String summary() {
        final String count = truncated ? "the first " + matches.size() : String.valueOf(matches.size());
        return "Showing " + count + " result" + (matches.size() == 1 ? "" : "s")
                + " where " + query.describe() + " (took " + durationMs + " ms)";
    }
}
