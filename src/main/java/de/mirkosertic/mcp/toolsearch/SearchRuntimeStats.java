package de.mirkosertic.mcp.toolsearch;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe aggregate statistics for search runtime performance.
 *
 * <p>Counters are atomic so recording stays lock-free on the hot path. A circular buffer
 * (guarded by a dedicated lock) keeps the last {@value #BUFFER_SIZE} durations for
 * percentile computation. Durations are in microseconds because a catalog search usually
 * finishes well below one millisecond.</p>
 */
public class SearchRuntimeStats {

    private static final int BUFFER_SIZE = 1000;

    private final AtomicLong totalSearches = new AtomicLong(0);
    private final AtomicLong totalDurationMicros = new AtomicLong(0);
    private final AtomicLong totalResultCount = new AtomicLong(0);
    private final AtomicLong emptySearches = new AtomicLong(0);
    private final AtomicLong minDurationMicros = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong maxDurationMicros = new AtomicLong(0);

    private final long[] buffer = new long[BUFFER_SIZE];
    private int bufferIndex = 0;
    private boolean bufferFilled = false;
    private final Object lock = new Object();

    /**
     * Percentile values computed from the last recorded search durations, in microseconds.
     */
    public record Percentiles(long p50, long p75, long p90, long p95, long p99) {
    }

    /**
     * Records a completed search.
     *
     * @param durationMicros the search duration in microseconds
     * @param resultCount    the number of results returned
     */
    public void recordSearch(final long durationMicros, final int resultCount) {
        totalSearches.incrementAndGet();
        totalDurationMicros.addAndGet(durationMicros);
        totalResultCount.addAndGet(resultCount);
        if (resultCount == 0) {
            emptySearches.incrementAndGet();
        }

        // CAS loop for min
        long current;
        do {
            current = minDurationMicros.get();
            if (durationMicros >= current) break;
        } while (!minDurationMicros.compareAndSet(current, durationMicros));

        // CAS loop for max
        do {
            current = maxDurationMicros.get();
            if (durationMicros <= current) break;
        } while (!maxDurationMicros.compareAndSet(current, durationMicros));

        synchronized (lock) {
            buffer[bufferIndex] = durationMicros;
            bufferIndex = (bufferIndex + 1) % BUFFER_SIZE;
            if (!bufferFilled && bufferIndex == 0) {
                bufferFilled = true;
            }
        }
    }

    /**
     * Computes percentiles from the last recorded search durations.
     *
     * @return percentiles, or null if no searches have been recorded yet
     */
    public Percentiles getPercentiles() {
        final long[] snapshot;
        final int count;

        synchronized (lock) {
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
        totalSearches.set(0);
        totalDurationMicros.set(0);
        totalResultCount.set(0);
        emptySearches.set(0);
        minDurationMicros.set(Long.MAX_VALUE);
        maxDurationMicros.set(0);
        synchronized (lock) {
            bufferIndex = 0;
            bufferFilled = false;
            Arrays.fill(buffer, 0L);
        }
    }

    public long getTotalSearches() {
        return totalSearches.get();
    }

    public long getTotalDurationMicros() {
        return totalDurationMicros.get();
    }

    public long getTotalResultCount() {
        return totalResultCount.get();
    }

    /**
     * Returns the number of searches that returned no results.
     */
    public long getEmptySearches() {
        return emptySearches.get();
    }

    /**
     * Returns the minimum recorded duration, or {@link Long#MAX_VALUE} if nothing was recorded.
     */
    public long getMinDurationMicros() {
        return minDurationMicros.get();
    }

    public long getMaxDurationMicros() {
        return maxDurationMicros.get();
    }

    /**
     * Returns the average search duration in microseconds, or 0.0 if no searches recorded.
     */
    public double getAverageDurationMicros() {
        final long searches = totalSearches.get();
        if (searches == 0) {
            return 0.0;
        }
        return (double) totalDurationMicros.get() / searches;
    }

    /**
     * Returns the average number of results per search, or 0.0 if no searches recorded.
     */
    public double getAverageResultCount() {
        final long searches = totalSearches.get();
        if (searches == 0) {
            return 0.0;
        }
        return (double) totalResultCount.get() / searches;
    }
}
