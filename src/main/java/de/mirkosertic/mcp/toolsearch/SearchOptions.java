package de.mirkosertic.mcp.toolsearch;

/**
 * Per-call search configuration.
 *
 * <p>Negative values are clamped to zero: a negative limit returns no results, and a
 * negative (or NaN) threshold behaves like a threshold of zero, which admits every tool
 * including those that matched nothing.</p>
 *
 * @param threshold   minimum score (inclusive) for a tool to be returned
 * @param limit       maximum number of results
 * @param useSynonyms whether the query is expanded with synonyms
 */
public record SearchOptions(
        double threshold,
        int limit,
        boolean useSynonyms
) {
    public static final double DEFAULT_THRESHOLD = 0.3;
    public static final int DEFAULT_LIMIT = 10;
    public static final boolean DEFAULT_USE_SYNONYMS = true;

    public SearchOptions {
        threshold = threshold > 0 ? threshold : 0;
        limit = Math.max(limit, 0);
    }

    public static SearchOptions defaults() {
        return new SearchOptions(DEFAULT_THRESHOLD, DEFAULT_LIMIT, DEFAULT_USE_SYNONYMS);
    }

    public SearchOptions withThreshold(final double newThreshold) {
        return new SearchOptions(newThreshold, limit, useSynonyms);
    }

    public SearchOptions withLimit(final int newLimit) {
        return new SearchOptions(threshold, newLimit, useSynonyms);
    }

    public SearchOptions withSynonyms(final boolean enabled) {
        return new SearchOptions(threshold, limit, enabled);
    }
}
