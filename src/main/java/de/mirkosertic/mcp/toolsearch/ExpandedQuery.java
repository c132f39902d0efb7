package de.mirkosertic.mcp.toolsearch;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Query terms after synonym expansion.
 *
 * @param expandedTokens the query tokens plus related terms; duplicates add weight again
 * @param originalTokens the tokens of the unexpanded query, matched at full weight
 */
public record ExpandedQuery(
        List<String> expandedTokens,
        Set<String> originalTokens
) {
    public ExpandedQuery {
        expandedTokens = List.copyOf(expandedTokens);
        originalTokens = Set.copyOf(originalTokens);
    }

    /**
     * Query without expansion: every token is an original token.
     */
    public static ExpandedQuery unexpanded(final List<String> queryTokens) {
        return new ExpandedQuery(queryTokens, new LinkedHashSet<>(queryTokens));
    }

    public boolean isOriginal(final String token) {
        return originalTokens.contains(token);
    }

    public boolean isEmpty() {
        return expandedTokens.isEmpty();
    }
}
