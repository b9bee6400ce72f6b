package de.mirkosertic.cardsearch.query;

/**
 * How values of a field are parsed and compared.
 */
public enum FieldKind {

    /** Signed integers, compared with all six operators. */
    NUMERIC,

    /** A single free-text string, matched by substring or regex. */
    TEXT,

    /** Tags from a small vocabulary, matched by exact equality against any tag of the card. */
    ENUM_LIKE,

    /** Free text held as several strings per card; a hit on any string counts. */
    MULTI_TOKEN;

    public boolean isTextual() {
        return this == TEXT || this == MULTI_TOKEN;
    }

    public boolean supportsComparison() {
        return this == NUMERIC;
    }
}
