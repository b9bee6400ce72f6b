package de.mirkosertic.cardsearch.query;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A searchable card field: its canonical name, the aliases users may type and its {@link FieldKind}.
 *
 * @param canonicalName the name used in card records and in the canonical query form
 * @param aliases       lower-case aliases, including the canonical name
 * @param kind          value kind
 * @param allowsUnknown whether {@code ?} may be used to find cards where the value is unknown
 */
public record FieldSpec(String canonicalName, Set<String> aliases, FieldKind kind, boolean allowsUnknown) {

    public FieldSpec {
        canonicalName = canonicalName.toLowerCase(Locale.ROOT);
        aliases = aliases.stream()
                .map(alias -> alias.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        if (!aliases.contains(canonicalName)) {
            throw new IllegalArgumentException("Aliases of " + canonicalName + " must include the canonical name");
        }
    }

    public static FieldSpec of(final String canonicalName, final FieldKind kind, final String... aliases) {
        final Set<String> all = new HashSet<>(Set.of(aliases));
        all.add(canonicalName);
        return new FieldSpec(canonicalName, all, kind, false);
    }

    public FieldSpec withUnknownSupport() {
        return new FieldSpec(canonicalName, aliases, kind, true);
    }
}
