package de.mirkosertic.cardsearch;

import de.mirkosertic.cardsearch.config.ApplicationConfig;
import de.mirkosertic.cardsearch.filter.CardRecord;
import de.mirkosertic.cardsearch.filter.CompiledQuery;
import de.mirkosertic.cardsearch.query.FieldRegistry;
import de.mirkosertic.cardsearch.query.QueryBuilder;
import de.mirkosertic.cardsearch.query.QueryParseException;
import de.mirkosertic.cardsearch.query.RegexCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs queries over an in-memory card collection.
 *
 * <p>Matches are returned in collection order and capped at the configured result limit.
 * Large collections are filtered with a parallel stream; the order is kept either way.
 * When a timeout is configured, evaluation runs on a worker thread and the caller stops
 * waiting once the deadline passes.</p>
 */
public class CardSearchService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CardSearchService.class);

    private final QueryBuilder queryBuilder;
    private final RegexCache regexCache;
    private final QueryRuntimeStats stats = new QueryRuntimeStats();
    private final ExecutorService executor;
    private final int resultLimit;
    private final long timeoutMs;
    private final int parallelThreshold;

    public CardSearchService(final ApplicationConfig config) {
        this(config, new RegexCache(config.getRegexCacheSize()));
    }

    private CardSearchService(final ApplicationConfig config, final RegexCache regexCache) {
        this(config, regexCache, new QueryBuilder(FieldRegistry.defaults(), regexCache, config.getMaxClauses()));
    }

    CardSearchService(final ApplicationConfig config, final RegexCache regexCache, final QueryBuilder queryBuilder) {
        if (config.getResultLimit() < 1) {
            throw new IllegalArgumentException("result limit must be positive, was " + config.getResultLimit());
        }
        this.queryBuilder = queryBuilder;
        this.regexCache = regexCache;
        this.resultLimit = config.getResultLimit();
        this.timeoutMs = config.getTimeoutMs();
        this.parallelThreshold = config.getParallelThreshold();

        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "card-search-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        this.executor = Executors.newFixedThreadPool(Math.max(1, config.getThreadPoolSize()), threadFactory);

        logger.info("CardSearchService initialized: resultLimit={}, timeoutMs={}, parallelThreshold={}",
                resultLimit, timeoutMs, parallelThreshold);
    }

    /**
     * Searches plain card records.
     */
    public SearchResult<CardRecord> search(final String rawQuery, final List<CardRecord> records)
            throws QueryParseException {
        return search(rawQuery, records, Function.identity());
    }

    /**
     * Searches any card type that can be viewed as a {@link CardRecord}.
     *
     * @param rawQuery the query as typed by the user
     * @param cards    the collection to search, in display order
     * @param view     maps a card to the record the query is evaluated against
     * @return the matching cards
     * @throws QueryParseException    if the query is invalid; nothing is evaluated then
     * @throws SearchTimeoutException if evaluation exceeds the configured timeout
     */
    public <T> SearchResult<T> search(final String rawQuery, final List<T> cards,
                                      final Function<? super T, CardRecord> view) throws QueryParseException {
        final CompiledQuery compiled;
        try {
            compiled = queryBuilder.compile(rawQuery);
        } catch (final QueryParseException e) {
            stats.recordParseFailure(e.getKind());
            throw e;
        }

        final long start = System.nanoTime();
        final List<T> hits = evaluateWithDeadline(rawQuery, compiled, cards, view);
        final long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        final boolean truncated = hits.size() > resultLimit;
        final List<T> matches = truncated ? hits.subList(0, resultLimit) : hits;

        final Set<String> fields = compiled.query().clauses().stream()
                .map(clause -> clause.field().canonicalName())
                .collect(Collectors.toSet());
        stats.recordQuery(durationMs, matches.size(), fields);

        logger.debug("Query “{}” matched {}{} of {} cards in {} ms", compiled.query().toQueryString(),
                matches.size(), truncated ? "+" : "", cards.size(), durationMs);

        return new SearchResult<>(compiled.query(), matches, truncated, durationMs);
    }

    private <T> List<T> evaluateWithDeadline(final String rawQuery, final CompiledQuery query, final List<T> cards,
                                             final Function<? super T, CardRecord> view) {
        if (timeoutMs <= 0) {
            return evaluate(query, cards, view);
        }
        final Future<List<T>> future = executor.submit(() -> evaluate(query, cards, view));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            future.cancel(true);
            logger.warn("Query “{}” exceeded the {} ms deadline over {} cards", rawQuery, timeoutMs, cards.size());
            throw new SearchTimeoutException(rawQuery, timeoutMs);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Search failed", cause);
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for search results", e);
        }
    }

    private <T> List<T> evaluate(final CompiledQuery query, final List<T> cards,
                                 final Function<? super T, CardRecord> view) {
        final Stream<T> stream = cards.size() >= parallelThreshold ? cards.parallelStream() : cards.stream();
        // One extra match tells whether the result was truncated
        return stream
                .filter(card -> query.test(view.apply(card)))
                .limit(resultLimit + 1L)
                .collect(Collectors.toList());
    }

    public QueryRuntimeStats getStats() {
        return stats;
    }

    public RegexCache getRegexCache() {
        return regexCache;
    }

    public QueryBuilder getQueryBuilder() {
        return queryBuilder;
    }

    /**
     * Shutdown the search workers. Should be called on application shutdown.
     */
    @Override
    public void close() {
        logger.debug("Shutting down CardSearchService");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Search workers did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for search workers to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
