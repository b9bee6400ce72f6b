package de.mirkosertic.cardsearch;

import de.mirkosertic.cardsearch.query.ParseErrorKind;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe aggregate statistics collector for card searches.
 *
 * <p>Tracks search durations and hit counts using atomic counters for lock-free
 * increments on the hot path. A circular buffer (guarded by a dedicated lock)
 * stores the last 1000 search durations for percentile computation. Rejected
 * queries are counted per {@link ParseErrorKind}, and accepted ones per field used.</p>
 */
public class QueryRuntimeStats {

    private static final int BUFFER_SIZE = 1000;

    private final AtomicLong totalQueries = new AtomicLong(0);
    private final AtomicLong totalDurationMs = new AtomicLong(0);
    private final AtomicLong totalHitCount = new AtomicLong(0);
    private final AtomicLong minDurationMs = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong maxDurationMs = new AtomicLong(0);
    private final ConcurrentHashMap<String, AtomicLong> fieldUsage = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ParseErrorKind, AtomicLong> parseFailures = new ConcurrentHashMap<>();

    private final long[] buffer = new long[BUFFER_SIZE];
    private int bufferIndex = 0;
    private boolean bufferFilled = false;
    private final Object lock = new Object();

    /**
     * Percentile values computed from the last 1000 recorded search durations.
     */
    public record Percentiles(long p50, long p75, long p90, long p95, long p99) {
    }

    /**
     * Records a completed search.
     *
     * @param durationMs the search duration in milliseconds
     * @param hits       the number of matching cards returned
     * @param fields     canonical names of the fields the query filtered on
     */
    public void recordQuery(final long durationMs, final long hits, final Collection<String> fields) {
        totalQueries.incrementAndGet();
        totalDurationMs.addAndGet(durationMs);
        totalHitCount.addAndGet(hits);

        // CAS loop for min
        long current;
        do {
            current = minDurationMs.get();
            if (durationMs >= current) break;
        } while (!minDurationMs.compareAndSet(current, durationMs));

        // CAS loop for max
        do {
            current = maxDurationMs.get();
            if (durationMs <= current) break;
        } while (!maxDurationMs.compareAndSet(current, durationMs));

        synchronized (lock) {
            buffer[bufferIndex] = durationMs;
            bufferIndex = (bufferIndex + 1) % BUFFER_SIZE;
            if (!bufferFilled && bufferIndex == 0) {
                bufferFilled = true;
            }
        }

        for (final String field : fields) {
            fieldUsage.computeIfAbsent(field, k -> new AtomicLong()).incrementAndGet();
        }
    }

    /**
     * Records a query that was rejected by the parser.
     */
    public void recordParseFailure(final ParseErrorKind kind) {
        parseFailures.computeIfAbsent(kind, k -> new AtomicLong()).incrementAndGet();
    }

    /**
     * Computes percentiles from the last 1000 recorded search durations.
     *
     * @return percentiles, or null if no searches have been recorded yet
     */
    public Percentiles getPercentiles() {
        final long[] snapshot;
        final int count;

        synchronized (lock) {
            if (totalQueries.get() == 0) {
                return null;
            }
            if (bufferFilled) {
                snapshot = Arrays.copyOf(buffer, BUFFER_SIZE);
                count = BUFFER_SIZE;
            } else {
                snapshot = Arrays.copyOf(buffer, bufferIndex);
                count = bufferIndex;
            }
        }

        if (count == 0) {
            return null;
        }

        Arrays.sort(snapshot, 0, count);

        return new Percentiles(
                percentileValue(snapshot, count, 50),
                percentileValue(snapshot, count, 75),
                percentileValue(snapshot, count, 90),
                percentileValue(snapshot, count, 95),
                percentileValue(snapshot, count, 99));
    }

    private static long percentileValue(final long[] sortedData, final int count, final int percentile) {
        final int index = (int) Math.ceil(percentile / 100.0 * count) - 1;
        return sortedData[Math.max(0, Math.min(index, count - 1))];
    }

    /**
     * Resets all counters and clears the circular buffer.
     */
    public void reset() {
        totalQueries.set(0);
        totalDurationMs.set(0);
        totalHitCount.set(0);
        minDurationMs.set(Long.MAX_VALUE);
        maxDurationMs.set(0);
        synchronized (lock) {
            bufferIndex = 0;
            bufferFilled = false;
            Arrays.fill(buffer, 0L);
        }
        fieldUsage.clear();
        parseFailures.clear();
    }

    public long getTotalQueries() {
        return totalQueries.get();
    }

    public long getTotalDurationMs() {
        return totalDurationMs.get();
    }

    public long getTotalHitCount() {
        return totalHitCount.get();
    }

    /**
     * Returns the minimum recorded duration in milliseconds,
     * or {@link Long#MAX_VALUE} if nothing has been recorded.
     */
    public long getMinDurationMs() {
        return minDurationMs.get();
    }

    public long getMaxDurationMs() {
        return maxDurationMs.get();
    }

    public double getAverageDurationMs() {
        final long queries = totalQueries.get();
        if (queries == 0) {
            return 0.0;
        }
        return (double) totalDurationMs.get() / queries;
    }

    public double getAverageHitCount() {
        final long queries = totalQueries.get();
        if (queries == 0) {
            return 0.0;
        }
        return (double) totalHitCount.get() / queries;
    }

    /**
     * Returns a snapshot of how many accepted queries filtered on each field.
     */
    public Map<String, Long> getFieldUsage() {
        final Map<String, Long> snapshot = new HashMap<>();
        for (final var entry : fieldUsage.entrySet()) {
            snapshot.put(entry.getKey(), entry.getValue().get());
        }
        return snapshot;
    }

    /**
     * Returns a snapshot of rejected queries per error kind.
     */
    public Map<ParseErrorKind, Long> getParseFailures() {
        final Map<ParseErrorKind, Long> snapshot = new EnumMap<>(ParseErrorKind.class);
        for (final var entry : parseFailures.entrySet()) {
            snapshot.put(entry.getKey(), entry.getValue().get());
        }
        return snapshot;
    }

    public long getTotalParseFailures() {
        return parseFailures.values().stream().mapToLong(AtomicLong::get).sum();
    }
}
