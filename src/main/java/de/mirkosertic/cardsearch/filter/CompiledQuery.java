package de.mirkosertic.cardsearch.filter;

import de.mirkosertic.cardsearch.query.Query;

import java.util.function.Predicate;

/**
 * A parsed query bound to an evaluator, ready to be applied to card records.
 */
public record CompiledQuery(Query query, FilterEvaluator evaluator) implements Predicate<CardRecord> {

    @Override
    public boolean test(final CardRecord record) {
        return evaluator.matches(query, record);
    }
}
