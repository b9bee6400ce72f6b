package de.mirkosertic.cardsearch.filter;

import de.mirkosertic.cardsearch.query.Clause;
import de.mirkosertic.cardsearch.query.FieldRegistry;
import de.mirkosertic.cardsearch.query.FieldSpec;
import de.mirkosertic.cardsearch.query.Operator;
import de.mirkosertic.cardsearch.query.Query;
import de.mirkosertic.cardsearch.query.Value;
import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a card record satisfies a {@link Query}.
 *
 * <h2>Matching rules by field kind</h2>
 * <ul>
 *   <li><b>Numeric:</b> the operator's natural comparison; a set matches if any member is equal
 *       ({@code =}) or none is ({@code !=}).</li>
 *   <li><b>Text / multi-token:</b> {@code =} is substring containment, or {@link java.util.regex.Matcher#find()}
 *       for regex values, against any of the card's strings; {@code !=} negates.</li>
 *   <li><b>Enum-like:</b> {@code =} is exact equality with any of the card's tags; {@code !=} negates.</li>
 * </ul>
 * A field the card does not have, or holds in the wrong shape, fails the clause whatever the
 * operator. The only exception is the unknown marker: {@code atk:?} matches monsters that lack
 * the value, {@code atk!=?} monsters that have it. Cards that are not monsters fail both.
 * <p>
 * Query literals arrive folded by the parser. Records from {@link CardRecord#of} are folded too,
 * but any other {@link CardRecord} is read leniently: integral numbers of any width, strings
 * folded to lower case here, non-string list elements skipped. Evaluation never throws and keeps
 * no state, so one instance can serve any number of threads.
 */
public class FilterEvaluator {

    private static final String MONSTER_TAG = "monster";

    public boolean matches(final Query query, final CardRecord record) {
        for (final Clause clause : query.clauses()) {
            if (!matches(clause, record)) {
                return false;
            }
        }
        return true;
    }

    public boolean matches(final Clause clause, final CardRecord record) {
        final FieldSpec field = clause.field();
        final Operator operator = clause.operator();
        final Value value = clause.value();

        if (value == Value.UnknownValue.INSTANCE) {
            if (!hasStat(field, record)) {
                return false;
            }
            final boolean unknown = record.value(field.canonicalName()) == null;
            return operator == Operator.NE ? !unknown : unknown;
        }

        final Object actual = record.value(field.canonicalName());
        if (actual == null) {
            return false;
        }
        return switch (field.kind()) {
            case NUMERIC -> matchesNumber(operator, value, actual);
            case TEXT, MULTI_TOKEN -> matchesText(operator, value, strings(actual));
            case ENUM_LIKE -> matchesTag(operator, value, strings(actual));
        };
    }

    private static boolean matchesNumber(final Operator operator, final Value value, final Object actual) {
        final Long number = integral(actual);
        if (number == null) {
            return false;
        }
        if (value instanceof Value.IntegerValue expected) {
            return operator.compare(number, expected.value());
        }
        if (value instanceof Value.SetValue set) {
            final boolean any = set.members().stream()
                    .anyMatch(member -> member instanceof Value.IntegerValue expected && expected.value() == number.longValue());
            return operator == Operator.NE ? !any : any;
        }
        return false;
    }

    private static boolean matchesText(final Operator operator, final Value value, final List<String> strings) {
        if (strings.isEmpty()) {
            return false;
        }
        final boolean hit = strings.stream().anyMatch(text -> textHit(value, text));
        return operator == Operator.NE ? !hit : hit;
    }

    private static boolean textHit(final Value value, final String text) {
        if (value instanceof Value.TextValue literal) {
            return text.contains(literal.text());
        }
        if (value instanceof Value.RegexValue regex) {
            return regex.pattern().matcher(text).find();
        }
        if (value instanceof Value.SetValue set) {
            return set.members().stream().anyMatch(member -> textHit(member, text));
        }
        return false;
    }

    private static boolean matchesTag(final Operator operator, final Value value, final List<String> tags) {
        if (tags.isEmpty()) {
            return false;
        }
        final boolean hit = tags.stream().anyMatch(tag -> tagHit(value, tag));
        return operator == Operator.NE ? !hit : hit;
    }

    private static boolean tagHit(final Value value, final String tag) {
        if (value instanceof Value.TextValue literal) {
            return tag.equals(literal.text());
        }
        if (value instanceof Value.SetValue set) {
            return set.members().stream().anyMatch(member -> tagHit(member, tag));
        }
        return false;
    }

    /**
     * Whether the card has the stat at all, printed or as {@code ?}. ATK and DEF of some monsters
     * are printed as {@code ?} and arrive as absent values. Link monsters have no DEF.
     */
    private static boolean hasStat(final FieldSpec field, final CardRecord record) {
        if (!strings(record.value(FieldRegistry.TYPE)).contains(MONSTER_TAG)) {
            return false;
        }
        return !FieldRegistry.DEF.equals(field.canonicalName()) || record.value(FieldRegistry.LINK_RATING) == null;
    }

    private static @Nullable Long integral(final Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        return null;
    }

    private static List<String> strings(final @Nullable Object value) {
        if (value instanceof String text) {
            return List.of(text.toLowerCase(Locale.ROOT));
        }
        if (value instanceof Collection<?> values) {
            return values.stream()
                    .filter(String.class::isInstance)
                    .map(element -> ((String) element).toLowerCase(Locale.ROOT))
                    .toList();
        }
        return List.of();
    }
}
