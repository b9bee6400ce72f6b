package de.mirkosertic.cardsearch.card;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the card dump, a JSON object with a {@code data} array of cards, and the set list,
 * a JSON array of sets with their TCG release dates.
 */
public class CardDataLoader {

    private static final Logger logger = LoggerFactory.getLogger(CardDataLoader.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CardDump(List<Card> data) {
    }

    private final ObjectMapper objectMapper;

    public CardDataLoader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public CardDataLoader(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Card> load(final Path file) throws IOException {
        final long start = System.currentTimeMillis();
        try (InputStream in = Files.newInputStream(file)) {
            final List<Card> cards = load(in);
            logger.info("Read {} cards from {} in {} ms", cards.size(), file, System.currentTimeMillis() - start);
            return cards;
        }
    }

    public List<Card> load(final InputStream in) throws IOException {
        final CardDump dump = objectMapper.readValue(in, CardDump.class);
        if (dump == null || dump.data() == null) {
            throw new IOException("Card dump has no data array");
        }
        return List.copyOf(dump.data());
    }

    public Map<String, LocalDate> loadReleaseDates(final Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            final Map<String, LocalDate> dates = loadReleaseDates(in);
            logger.info("Read release dates of {} sets from {}", dates.size(), file);
            return dates;
        }
    }

    /**
     * Reads the set list into TCG release dates keyed by lower case set name.
     * Sets without a TCG date are left out.
     */
    public Map<String, LocalDate> loadReleaseDates(final InputStream in) throws IOException {
        final List<CardSetInfo> sets = objectMapper.readValue(in, new TypeReference<List<CardSetInfo>>() {
        });
        if (sets == null) {
            throw new IOException("Set list is empty");
        }
        final Map<String, LocalDate> dates = new HashMap<>();
        for (final CardSetInfo set : sets) {
            if (set.setName() == null || set.tcgDate() == null || set.tcgDate().isBlank()) {
                continue;
            }
            try {
                dates.put(set.setName().toLowerCase(Locale.ROOT), LocalDate.parse(set.tcgDate().trim()));
            } catch (final DateTimeParseException e) {
                logger.debug("Ignoring unparseable release date '{}' of {}", set.tcgDate(), set.setName());
            }
        }
        return Map.copyOf(dates);
    }
}
