package de.mirkosertic.cardsearch.query;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A parsed search: all clauses must match.
 */
public record Query(List<Clause> clauses) {

    public Query {
        clauses = List.copyOf(clauses);
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    /**
     * Canonical serialization. Parsing the result yields an equal query.
     */
    public String toQueryString() {
        return clauses.stream()
                .map(Clause::toQueryString)
                .collect(Collectors.joining(" "));
    }

    public String describe() {
        if (clauses.isEmpty()) {
            return "any card";
        }
        return clauses.stream()
                .map(Clause::describe)
                .collect(Collectors.joining(" and "));
    }

    @Override
    public String toString() {
        return toQueryString();
    }
}
