package de.mirkosertic.mcp.toolsearch.mcp.dto;

import de.mirkosertic.mcp.toolsearch.SearchRuntimeStats;
import de.mirkosertic.mcp.toolsearch.TokenizerCacheStats;
import de.mirkosertic.mcp.toolsearch.mcp.ToolResultHelper;

/**
 * Response DTO for the getSearchStats tool. Durations are in microseconds.
 */
public record SearchStatsResponse(
        boolean success,
        long totalSearches,
        long emptySearches,
        double averageDurationMicros,
        Long minDurationMicros,
        long maxDurationMicros,
        double averageResultCount,
        SearchRuntimeStats.Percentiles durationPercentiles,
        double tokenizerCacheHitRate,
        long tokenizerCacheSize,
        int catalogTools,
        String version,
        String error
) implements ToolResultHelper.Failable {

    public static SearchStatsResponse success(final SearchRuntimeStats stats, final TokenizerCacheStats cacheStats,
                                              final int catalogTools, final String version) {
        final long totalSearches = stats.getTotalSearches();
        return new SearchStatsResponse(
                true,
                totalSearches,
                stats.getEmptySearches(),
                stats.getAverageDurationMicros(),
                totalSearches > 0 ? stats.getMinDurationMicros() : null,
                stats.getMaxDurationMicros(),
                stats.getAverageResultCount(),
                stats.getPercentiles(),
                cacheStats.getHitRate(),
                cacheStats.getCurrentSize(),
                catalogTools,
                version,
                null
        );
    }

    public static SearchStatsResponse error(final String errorMessage) {
        return new SearchStatsResponse(false, 0, 0, 0, null, 0, 0, null, 0, 0, 0, null, errorMessage);
    }
}
