package de.mirkosertic.cardsearch.query;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup from field alias to {@link FieldSpec}.
 * <p>
 * Built once and handed to the parser; lookups are case-insensitive. Construction fails
 * if two fields claim the same alias, so every alias resolves to exactly one field.
 *
 * <h2>Default fields</h2>
 * <pre>
 * name                          text (bare terms search here)
 * text, effect, eff, e, o       multi-token text (pendulum and monster effect)
 * atk, def                      numeric, {@code ?} finds unknown values
 * level, l                      numeric (includes rank)
 * linkrating, lr                numeric
 * type, t, class, c             enum-like (card frame words and monster type)
 * attribute, attr, a            enum-like
 * set, s                        enum-like (set code prefixes)
 * year, y                       numeric
 * copies, legal                 numeric (0 banned ... 3 unlimited)
 * price, p                      numeric
 * </pre>
 * {@code class} is kept as a legacy alias of the merged type field.
 */
public final class FieldRegistry {

    public static final String NAME = "name";
    public static final String TEXT = "text";
    public static final String ATK = "atk";
    public static final String DEF = "def";
    public static final String LEVEL = "level";
    public static final String LINK_RATING = "linkrating";
    public static final String TYPE = "type";
    public static final String ATTRIBUTE = "attribute";
    public static final String SET = "set";
    public static final String YEAR = "year";
    public static final String COPIES = "copies";
    public static final String PRICE = "price";

    private static final FieldRegistry DEFAULTS = new FieldRegistry(List.of(
            FieldSpec.of(NAME, FieldKind.TEXT),
            FieldSpec.of(TEXT, FieldKind.MULTI_TOKEN, "effect", "eff", "e", "o"),
            FieldSpec.of(ATK, FieldKind.NUMERIC).withUnknownSupport(),
            FieldSpec.of(DEF, FieldKind.NUMERIC).withUnknownSupport(),
            FieldSpec.of(LEVEL, FieldKind.NUMERIC, "l"),
            FieldSpec.of(LINK_RATING, FieldKind.NUMERIC, "lr"),
            FieldSpec.of(TYPE, FieldKind.ENUM_LIKE, "t", "class", "c"),
            FieldSpec.of(ATTRIBUTE, FieldKind.ENUM_LIKE, "attr", "a"),
            FieldSpec.of(SET, FieldKind.ENUM_LIKE, "s"),
            FieldSpec.of(YEAR, FieldKind.NUMERIC, "y"),
            FieldSpec.of(COPIES, FieldKind.NUMERIC, "legal"),
            FieldSpec.of(PRICE, FieldKind.NUMERIC, "p")
    ));

    private final Map<String, FieldSpec> byAlias;
    private final Map<String, FieldSpec> byCanonicalName;

    public FieldRegistry(final Collection<FieldSpec> fields) {
        final Map<String, FieldSpec> aliases = new LinkedHashMap<>();
        final Map<String, FieldSpec> canonical = new LinkedHashMap<>();
        for (final FieldSpec field : fields) {
            for (final String alias : field.aliases()) {
                final FieldSpec previous = aliases.putIfAbsent(alias, field);
                if (previous != null) {
                    throw new IllegalArgumentException("Alias '" + alias + "' is claimed by both "
                            + previous.canonicalName() + " and " + field.canonicalName());
                }
            }
            canonical.put(field.canonicalName(), field);
        }
        if (!canonical.containsKey(NAME)) {
            throw new IllegalArgumentException("A registry needs a '" + NAME + "' field for bare search terms");
        }
        this.byAlias = Map.copyOf(aliases);
        this.byCanonicalName = Map.copyOf(canonical);
    }

    public static FieldRegistry defaults() {
        return DEFAULTS;
    }

    public Optional<FieldSpec> resolve(final String alias) {
        return Optional.ofNullable(byAlias.get(alias.toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns the field with the given canonical name.
     *
     * @throws IllegalArgumentException if no such field is registered
     */
    public FieldSpec field(final String canonicalName) {
        final FieldSpec field = byCanonicalName.get(canonicalName);
        if (field == null) {
            throw new IllegalArgumentException("No field named " + canonicalName);
        }
        return field;
    }

    /**
     * The field bare search terms are matched against.
     */
    public FieldSpec nameField() {
        return byCanonicalName.get(NAME);
    }

    public Collection<FieldSpec> fields() {
        return byCanonicalName.values();
    }
}
