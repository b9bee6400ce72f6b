package de.mirkosertic.cardsearch.query;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Memoizes compiled query patterns by their source text.
 *
 * <p>The same query is typically evaluated against every card, and popular patterns repeat
 * across requests, so each distinct pattern is compiled once per process. The cache is
 * bounded and thread-safe. Patterns that fail to compile are not cached.</p>
 */
public class RegexCache {

    /**
     * Query regexes always ignore case and nothing else.
     */
    public static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    public static final int DEFAULT_MAXIMUM_SIZE = 1_000;

    private final Cache<String, Pattern> cache;

    public RegexCache() {
        this(DEFAULT_MAXIMUM_SIZE);
    }

    public RegexCache(final long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    /**
     * Returns the compiled pattern for {@code source}, compiling it on first use.
     *
     * @throws PatternSyntaxException if the pattern is malformed
     */
    public Pattern compile(final String source) {
        return cache.get(source, key -> Pattern.compile(key, FLAGS));
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
