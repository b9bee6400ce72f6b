package de.mirkosertic.cardsearch;

import de.mirkosertic.cardsearch.card.Card;
import de.mirkosertic.cardsearch.card.CardDataLoader;
import de.mirkosertic.cardsearch.card.CardRecordMapper;
import de.mirkosertic.cardsearch.config.ApplicationConfig;
import de.mirkosertic.cardsearch.config.LoggingConfigurator;
import de.mirkosertic.cardsearch.filter.CardRecord;
import de.mirkosertic.cardsearch.query.QueryParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point.
 * <p>
 * Loads the card dump and evaluates each query given as an argument, or one query per
 * line of standard input when there are none. {@code --quiet} limits logging to warnings.
 */
public class CardSearchApplication {

    private static final Logger logger = LoggerFactory.getLogger(CardSearchApplication.class);

    static final String QUIET_FLAG = "--quiet";

    /**
     * A card paired with its searchable record, so results can show the original spelling.
     */
    record IndexedCard(Card card, CardRecord record) {
    }

    private final CardSearchService searchService;
    private final PrintStream out;
    private final List<IndexedCard> cards = new ArrayList<>();

    public CardSearchApplication(final ApplicationConfig config, final PrintStream out) {
        this(new CardSearchService(config), out);
    }

    CardSearchApplication(final CardSearchService searchService, final PrintStream out) {
        this.searchService = searchService;
        this.out = out;
    }

    /**
     * Load the card dump configured in {@code cardsearch.data.cards-file}, with release years from
     * {@code cardsearch.data.sets-file} if one is configured.
     */
    public void init(final ApplicationConfig config) throws IOException {
        final CardDataLoader loader = new CardDataLoader();
        final String setsFile = config.getSetsFile();
        final Map<String, LocalDate> releaseDates = setsFile == null || setsFile.isBlank()
                ? Map.of()
                : loader.loadReleaseDates(Paths.get(setsFile));
        index(loader.load(Paths.get(config.getCardsFile())), releaseDates);
    }

    void index(final List<Card> loaded) {
        index(loaded, Map.of());
    }

    void index(final List<Card> loaded, final Map<String, LocalDate> releaseDates) {
        final CardRecordMapper mapper = new CardRecordMapper(releaseDates);
        cards.clear();
        for (final Card card : loaded) {
            cards.add(new IndexedCard(card, mapper.toRecord(card)));
        }
        logger.info("Indexed {} cards", cards.size());
    }

    /**
     * Runs one query and prints the outcome.
     *
     * @return true if the query was valid
     */
    public boolean runQuery(final String rawQuery) {
        try {
            final SearchResult<IndexedCard> result = searchService.search(rawQuery.trim(), cards, IndexedCard::record);
            out.println(result.summary());
            for (final IndexedCard match : result.matches()) {
                out.println(match.card().id() + "\t" + match.card().name());
            }
            return true;
        } catch (final QueryParseException e) {
            out.println("Could not parse query: " + e.getMessage());
            return false;
        } catch (final SearchTimeoutException e) {
            out.println(e.getMessage());
            return false;
        }
    }

    /**
     * Runs every query and returns the number that failed.
     */
    public int run(final List<String> queries) {
        int failures = 0;
        for (final String query : queries) {
            if (!runQuery(query)) {
                failures++;
            }
        }
        return failures;
    }

    public void shutdown() {
        searchService.close();
        final QueryRuntimeStats stats = searchService.getStats();
        logger.info("Ran {} searches (avg {} ms, {} rejected), regex cache: {}",
                stats.getTotalQueries(), String.format("%.1f", stats.getAverageDurationMs()),
                stats.getTotalParseFailures(), searchService.getRegexCache().stats());
    }

    public static void main(final String[] args) {
        final List<String> queries = new ArrayList<>();
        boolean quiet = Boolean.getBoolean("cardsearch.quiet");
        for (final String arg : args) {
            if (QUIET_FLAG.equals(arg)) {
                quiet = true;
            } else {
                queries.add(arg);
            }
        }

        // Configure logging FIRST, before any other code that might log
        LoggingConfigurator.configure(quiet);

        try {
            final ApplicationConfig config = ApplicationConfig.load();
            config.setQuietMode(quiet);

            final CardSearchApplication app = new CardSearchApplication(config, System.out);
            app.init(config);

            final int failures;
            if (queries.isEmpty()) {
                failures = app.run(readQueries());
            } else {
                failures = app.run(queries);
            }
            app.shutdown();
            System.exit(failures == 0 ? 0 : 2);
        } catch (final Exception e) {
            System.err.println("Card search failed: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }

    private static List<String> readQueries() throws IOException {
        final List<String> queries = new ArrayList<>();
        final BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isBlank()) {
                queries.add(line);
            }
        }
        return queries;
    }
}
