package de.mirkosertic.mcp.toolsearch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;

import java.util.List;

/**
 * Caching wrapper around a {@link TextTokenizer}.
 *
 * <p>Tool names and descriptions are tokenized again on every search because corpus
 * statistics are built per call. The text of a catalog rarely changes between calls, so
 * the token lists are memoized by their source text. Tokenization is a pure function,
 * which keeps cached and uncached results identical.</p>
 *
 * <p>Cache characteristics:</p>
 * <ul>
 *   <li>Bounded by a configurable maximum number of entries</li>
 *   <li>Thread-safe for concurrent searches</li>
 *   <li>Tracks hits, misses and evictions via {@link TokenizerCacheStats}</li>
 * </ul>
 */
public class CachedTextTokenizer implements TextTokenizer {

    private final TextTokenizer delegate;
    private final Cache<String, List<String>> cache;
    private final TokenizerCacheStats stats;

    /**
     * Creates a new caching tokenizer.
     *
     * @param delegate     the tokenizer to delegate cache misses to
     * @param maximumSize  maximum number of cached texts
     * @param stats        the statistics collector for tracking cache performance
     */
    public CachedTextTokenizer(final TextTokenizer delegate, final long maximumSize,
                               final TokenizerCacheStats stats) {
        this.delegate = delegate;
        this.stats = stats;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .evictionListener((String key, List<String> value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        stats.recordEviction();
                    }
                })
                .build();
    }

    @Override
    public List<String> tokenize(final String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        final List<String> cached = cache.getIfPresent(text);
        if (cached != null) {
            stats.recordHit();
            return cached;
        }

        final List<String> tokens = delegate.tokenize(text);
        cache.put(text, tokens);
        stats.recordMiss();
        stats.setCurrentSize(cache.estimatedSize());
        return tokens;
    }

    /**
     * Returns the cache statistics for monitoring.
     */
    public TokenizerCacheStats getStats() {
        return stats;
    }
}
