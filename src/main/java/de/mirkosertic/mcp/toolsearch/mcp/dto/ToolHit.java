package de.mirkosertic.mcp.toolsearch.mcp.dto;

import de.mirkosertic.mcp.toolsearch.SearchResult;
import de.mirkosertic.mcp.toolsearch.mcp.Description;

import java.util.List;

/**
 * A single tool in search results.
 */
public record ToolHit(
        @Description("Identifier of the server providing the tool")
        String server,

        @Description("Tool name")
        String name,

        @Description("Tool description (may be null)")
        String description,

        @Description("Raw BM25 score, only comparable within one result set")
        double score,

        @Description("Score relative to the best hit of this result set, between 0 and 1")
        double relevance,

        @Description("Query terms and synonyms found in the tool name or description")
        List<String> matchedTokens
) {
    /**
     * Convert a search result, normalizing its score against the best score of the result set.
     */
    public static ToolHit from(final SearchResult result, final double bestScore) {
        return new ToolHit(
                result.server(),
                result.tool().name(),
                result.tool().description(),
                result.score(),
                bestScore > 0 ? result.score() / bestScore : 0.0,
                result.matchedTokens()
        );
    }
}
