package de.mirkosertic.cardsearch;

/**
 * Thrown when evaluating a query over the card collection exceeds the configured deadline.
 */
public class SearchTimeoutException extends RuntimeException {

    private final long timeoutMs;

    public SearchTimeoutException(final String rawQuery, final long timeoutMs) {
        super("Search “" + rawQuery + "” did not finish within " + timeoutMs + " ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
