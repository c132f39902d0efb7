package de.mirkosertic.mcp.toolsearch;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe metrics collector for the tokenizer cache.
 *
 * <p>Tracks cache hits, misses and evictions and derives the hit rate.</p>
 */
public class TokenizerCacheStats {

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong cacheMisses = new AtomicLong(0);
    private final AtomicLong evictions = new AtomicLong(0);
    private final AtomicLong cacheSize = new AtomicLong(0);

    public void recordHit() {
        totalRequests.incrementAndGet();
        cacheHits.incrementAndGet();
    }

    public void recordMiss() {
        totalRequests.incrementAndGet();
        cacheMisses.incrementAndGet();
    }

    public void recordEviction() {
        evictions.incrementAndGet();
    }

    /**
     * Updates the current cache size.
     *
     * @param size the estimated number of entries in the cache
     */
    public void setCurrentSize(final long size) {
        cacheSize.set(size);
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    public long getCacheMisses() {
        return cacheMisses.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    public long getCurrentSize() {
        return cacheSize.get();
    }

    /**
     * Calculates the cache hit rate as a percentage (0-100).
     *
     * @return hit rate percentage, or 0.0 if nothing was tokenized yet
     */
    public double getHitRate() {
        final long total = totalRequests.get();
        if (total == 0) {
            return 0.0;
        }
        return (cacheHits.get() * 100.0) / total;
    }

    @Override
    public String toString() {
        return String.format(
                "TokenizerCacheStats[total=%d, hits=%d, misses=%d, hitRate=%.1f%%, size=%d, evictions=%d]",
                getTotalRequests(),
                getCacheHits(),
                getCacheMisses(),
                getHitRate(),
                getCurrentSize(),
                getEvictions()
        );
    }
}
