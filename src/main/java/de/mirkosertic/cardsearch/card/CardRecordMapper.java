package de.mirkosertic.cardsearch.card;

import de.mirkosertic.cardsearch.filter.CardRecord;
import de.mirkosertic.cardsearch.query.FieldRegistry;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds the searchable {@link CardRecord} of a {@link Card}.
 *
 * <ul>
 *   <li>{@code text}: pendulum cards carry two texts separated by a
 *       {@code [ Monster Effect ]} or {@code [ Flavor Text ]} header; they become two strings.</li>
 *   <li>{@code type}: the words of the card type plus the monster type, so
 *       {@code Fusion Monster}/{@code Dragon} is tagged fusion, monster and dragon.</li>
 *   <li>{@code set}: the set code prefixes of all printings ({@code LOB-EN001} gives lob).</li>
 *   <li>{@code copies}: from the TCG banlist.</li>
 *   <li>{@code price}: the cheapest printing in whole currency units, rounded down.</li>
 *   <li>{@code year}: the earliest TCG release year among the printings, when release dates are known.</li>
 * </ul>
 */
public class CardRecordMapper {

    private static final Logger logger = LoggerFactory.getLogger(CardRecordMapper.class);

    private static final Pattern PENDULUM_SEPARATOR =
            Pattern.compile("(\\n-+)?\\n\\[\\s?(Monster Effect|Flavor Text)\\s?]\\n?");
    private static final Pattern PENDULUM_HEADER = Pattern.compile("^\\[\\s?Pendulum Effect\\s?]\\n?");
    private static final Pattern WORD_SEPARATOR = Pattern.compile("\\s+");

    private final Map<String, LocalDate> releaseDates;

    public CardRecordMapper() {
        this(Map.of());
    }

    /**
     * @param releaseDates TCG release dates keyed by lower case set name
     */
    public CardRecordMapper(final Map<String, LocalDate> releaseDates) {
        this.releaseDates = releaseDates;
    }

    public CardRecord toRecord(final Card card) {
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(FieldRegistry.NAME, card.name());
        fields.put(FieldRegistry.TEXT, effectTexts(card.text()));
        fields.put(FieldRegistry.ATK, card.atk());
        fields.put(FieldRegistry.DEF, card.def());
        fields.put(FieldRegistry.LEVEL, card.level());
        fields.put(FieldRegistry.LINK_RATING, card.linkRating());
        fields.put(FieldRegistry.TYPE, typeTags(card));
        fields.put(FieldRegistry.ATTRIBUTE, card.attribute());
        fields.put(FieldRegistry.SET, setTags(card.cardSets()));
        fields.put(FieldRegistry.COPIES, card.banlistInfo() == null ? 3 : card.banlistInfo().copies());
        fields.put(FieldRegistry.PRICE, lowestPrice(card.cardSets()));
        fields.put(FieldRegistry.YEAR, firstReleaseYear(card.cardSets()));
        return CardRecord.of(fields);
    }

    static List<String> effectTexts(final @Nullable String text) {
        if (text == null) {
            return List.of();
        }
        final String normalized = text.replace("\r", "");
        final String[] parts = PENDULUM_SEPARATOR.split(normalized, 2);
        final List<String> texts = new ArrayList<>(parts.length);
        for (int i = 0; i < parts.length; i++) {
            final String part = i == 0 ? PENDULUM_HEADER.matcher(parts[i]).replaceFirst("") : parts[i];
            if (!part.isBlank()) {
                texts.add(part.trim());
            }
        }
        return texts;
    }

    private static List<String> typeTags(final Card card) {
        final Set<String> tags = new LinkedHashSet<>();
        if (card.cardType() != null) {
            for (final String word : WORD_SEPARATOR.split(card.cardType().trim())) {
                if (!word.isEmpty()) {
                    tags.add(word.toLowerCase(Locale.ROOT));
                }
            }
        }
        if (card.race() != null && !card.race().isBlank()) {
            tags.add(card.race().trim().toLowerCase(Locale.ROOT));
        }
        return List.copyOf(tags);
    }

    private static List<String> setTags(final List<Card.CardSet> sets) {
        final Set<String> tags = new LinkedHashSet<>();
        for (final Card.CardSet set : sets) {
            if (set.setCode() == null) {
                continue;
            }
            final int dash = set.setCode().indexOf('-');
            tags.add(dash < 0 ? set.setCode() : set.setCode().substring(0, dash));
        }
        return List.copyOf(tags);
    }

    private @Nullable Integer firstReleaseYear(final List<Card.CardSet> sets) {
        LocalDate first = null;
        for (final Card.CardSet set : sets) {
            if (set.setName() == null) {
                continue;
            }
            final LocalDate date = releaseDates.get(set.setName().toLowerCase(Locale.ROOT));
            if (date != null && (first == null || date.isBefore(first))) {
                first = date;
            }
        }
        return first == null ? null : first.getYear();
    }

    private static @Nullable Long lowestPrice(final List<Card.CardSet> sets) {
        BigDecimal lowest = null;
        for (final Card.CardSet set : sets) {
            if (set.setPrice() == null || set.setPrice().isBlank()) {
                continue;
            }
            try {
                final BigDecimal price = new BigDecimal(set.setPrice().trim());
                if (price.signum() > 0 && (lowest == null || price.compareTo(lowest) < 0)) {
                    lowest = price;
                }
            } catch (final NumberFormatException e) {
                logger.debug("Ignoring unparseable price '{}' of {}", set.setPrice(), set.setCode());
            }
        }
        return lowest == null ? null : lowest.setScale(0, RoundingMode.FLOOR).longValueExact();
    }
}
