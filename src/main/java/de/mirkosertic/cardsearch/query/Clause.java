package de.mirkosertic.cardsearch.query;

/**
 * One {@code field operator value} unit of a query.
 */
public record Clause(FieldSpec field, Operator operator, Value value) {

    /**
     * Renders the clause in canonical syntax: canonical field name, {@code :} for equality,
     * the lexeme of any other operator, then the value.
     */
    public String toQueryString() {
        return field.canonicalName() + operator.canonicalLexeme() + value.toQueryString();
    }

    /**
     * Renders the clause as readable text, e.g. {@code level is at least 4}.
     */
    public String describe() {
        return field.canonicalName() + " " + verb() + " " + value.describe();
    }

    private String verb() {
        final boolean negated = operator == Operator.NE;
        if (value instanceof Value.RegexValue) {
            return negated ? "does not match" : "matches";
        }
        if (field.kind().isTextual()) {
            return negated ? "does not contain" : "contains";
        }
        return operator.phrase();
    }
}
